package org.duplex.host.interceptors;

import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

import java.util.List;
import java.util.function.Predicate;

/**
 * Applies an ordered chain of interceptors to calls of selected method types and lets every other
 * call pass through untouched. The first interceptor of the chain is the outermost one, so it sees
 * the call before all others.
 */
public final class MethodTypeInterceptor implements ServerInterceptor {

    private final Predicate<MethodDescriptor.MethodType> selector;
    private final List<ServerInterceptor> chain;

    private MethodTypeInterceptor(final Predicate<MethodDescriptor.MethodType> selector, final List<ServerInterceptor> chain) {
        this.selector = selector;
        this.chain = List.copyOf(chain);
    }

    /**
     * @param chain The interceptors to apply, outermost first.
     * @return An interceptor applying the chain to unary calls only.
     */
    public static MethodTypeInterceptor unary(final List<ServerInterceptor> chain) {
        return new MethodTypeInterceptor(type -> type == MethodDescriptor.MethodType.UNARY, chain);
    }

    /**
     * @param chain The interceptors to apply, outermost first.
     * @return An interceptor applying the chain to client, server and bidirectional streaming calls.
     */
    public static MethodTypeInterceptor streaming(final List<ServerInterceptor> chain) {
        return new MethodTypeInterceptor(type -> type != MethodDescriptor.MethodType.UNARY, chain);
    }

    /**
     * @return true if the chain has no interceptors.
     */
    public boolean isEmpty() {
        return chain.isEmpty();
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                                 final Metadata headers,
                                                                 final ServerCallHandler<ReqT, RespT> next) {
        if (chain.isEmpty() || !selector.test(call.getMethodDescriptor().getType())) {
            return next.startCall(call, headers);
        }

        ServerCallHandler<ReqT, RespT> handler = next;
        for (int i = chain.size() - 1; i >= 0; i--) {
            final ServerInterceptor interceptor = chain.get(i);
            final ServerCallHandler<ReqT, RespT> inner = handler;
            handler = (innerCall, innerHeaders) -> interceptor.interceptCall(innerCall, innerHeaders, inner);
        }
        return handler.startCall(call, headers);
    }
}
