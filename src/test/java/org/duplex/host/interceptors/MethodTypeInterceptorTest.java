package org.duplex.host.interceptors;

import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MethodTypeInterceptorTest {

    @Mock
    private ServerCall<String, String> call;

    @Mock
    private ServerCallHandler<String, String> next;

    @Mock
    private ServerCall.Listener<String> listener;

    private final Metadata headers = new Metadata();
    private final List<String> seen = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        lenient().when(next.startCall(any(), same(headers))).thenReturn(listener);
    }

    @Test
    void unary_appliesChainOutermostFirst() {
        when(call.getMethodDescriptor()).thenReturn(method(MethodDescriptor.MethodType.UNARY));
        final MethodTypeInterceptor interceptor = MethodTypeInterceptor.unary(List.of(recording("first"), recording("second")));

        final ServerCall.Listener<String> result = interceptor.interceptCall(call, headers, next);

        assertThat(result).isSameAs(listener);
        assertThat(seen).containsExactly("first", "second");
        verify(next).startCall(same(call), same(headers));
    }

    @Test
    void unary_skipsStreamingCalls() {
        when(call.getMethodDescriptor()).thenReturn(method(MethodDescriptor.MethodType.SERVER_STREAMING));
        final MethodTypeInterceptor interceptor = MethodTypeInterceptor.unary(List.of(recording("unary")));

        interceptor.interceptCall(call, headers, next);

        assertThat(seen).isEmpty();
        verify(next).startCall(same(call), same(headers));
    }

    @Test
    void streaming_appliesToEveryStreamingType() {
        final MethodTypeInterceptor interceptor = MethodTypeInterceptor.streaming(List.of(recording("stream")));

        for (final MethodDescriptor.MethodType type : List.of(
            MethodDescriptor.MethodType.CLIENT_STREAMING,
            MethodDescriptor.MethodType.SERVER_STREAMING,
            MethodDescriptor.MethodType.BIDI_STREAMING,
            MethodDescriptor.MethodType.UNARY)) {
            when(call.getMethodDescriptor()).thenReturn(method(type));
            interceptor.interceptCall(call, headers, next);
        }

        assertThat(seen).containsExactly("stream", "stream", "stream");
    }

    @Test
    void emptyChain_isReportedEmpty() {
        assertThat(MethodTypeInterceptor.unary(List.of()).isEmpty()).isTrue();
        assertThat(MethodTypeInterceptor.streaming(List.of(recording("x"))).isEmpty()).isFalse();
    }

    private ServerInterceptor recording(final String name) {
        return new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> serverCall,
                                                                         final Metadata metadata,
                                                                         final ServerCallHandler<ReqT, RespT> handler) {
                seen.add(name);
                return handler.startCall(serverCall, metadata);
            }
        };
    }

    private static MethodDescriptor<String, String> method(final MethodDescriptor.MethodType type) {
        return MethodDescriptor.<String, String>newBuilder()
            .setType(type)
            .setFullMethodName("test.Svc/" + type.name())
            .setRequestMarshaller(StringMarshaller.INSTANCE)
            .setResponseMarshaller(StringMarshaller.INSTANCE)
            .build();
    }

    private enum StringMarshaller implements MethodDescriptor.Marshaller<String> {
        INSTANCE;

        @Override
        public InputStream stream(final String value) {
            return new ByteArrayInputStream(value.getBytes());
        }

        @Override
        public String parse(final InputStream stream) {
            throw new UnsupportedOperationException();
        }
    }
}
