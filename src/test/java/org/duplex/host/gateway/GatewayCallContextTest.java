package org.duplex.host.gateway;

import io.grpc.Metadata;
import io.javalin.http.Context;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

@Tag("unit")
class GatewayCallContextTest {

    @Test
    void of_sameRequest_returnsSameContext() {
        final Context request = requestWithAttributes();

        final GatewayCallContext first = GatewayCallContext.of(request);
        final GatewayCallContext second = GatewayCallContext.of(request);

        assertThat(second).isSameAs(first);
        assertThat(GatewayCallContext.of(requestWithAttributes())).isNotSameAs(first);
    }

    @Test
    void putHeader_rejectsBinaryAndEmptyKeys() {
        final GatewayCallContext call = new GatewayCallContext();

        assertThat(call.putHeader("Tenant", "acme")).isTrue();
        assertThat(call.putHeader("payload-bin", "AAEC")).isFalse();
        assertThat(call.putHeader("", "x")).isFalse();
        assertThat(call.putHeader("tenant", null)).isFalse();

        assertThat(call.getHeader("TENANT")).isEqualTo("acme");
        assertThat(call.getOutboundMetadata().keys()).containsExactly("tenant");
    }

    @Test
    void putHeader_invalidMetadataKey_isDropped() {
        final GatewayCallContext call = new GatewayCallContext();

        assertThat(call.putHeader("X!y", "v")).isFalse();
        assertThat(call.putHeader("tenant", "acme")).isTrue();

        assertThat(call.getOutboundMetadata().keys()).containsExactly("tenant");
    }

    @Test
    void getOutboundMetadata_returnsCopy() {
        final GatewayCallContext call = new GatewayCallContext();
        call.putHeader("a", "1");

        final Metadata copy = call.getOutboundMetadata();
        copy.put(Metadata.Key.of("b", Metadata.ASCII_STRING_MARSHALLER), "2");

        assertThat(call.getOutboundMetadata().keys()).containsExactly("a");
    }

    private static Context requestWithAttributes() {
        final Map<String, Object> attributes = new HashMap<>();
        final Context request = mock(Context.class);
        doAnswer(invocation -> attributes.get(invocation.<String>getArgument(0))).when(request).attribute(anyString());
        doAnswer(invocation -> attributes.put(invocation.getArgument(0), invocation.getArgument(1)))
            .when(request).attribute(anyString(), any());
        return request;
    }
}
