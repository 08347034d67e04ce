package org.duplex.host.interceptors;

import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the outcome and duration of every call at debug level.
 */
public class CallLoggingInterceptor implements ServerInterceptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallLoggingInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                                 final Metadata headers,
                                                                 final ServerCallHandler<ReqT, RespT> next) {
        if (!LOGGER.isDebugEnabled()) {
            return next.startCall(call, headers);
        }

        final long startNanos = System.nanoTime();
        final String method = call.getMethodDescriptor().getFullMethodName();
        return next.startCall(new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void close(final Status status, final Metadata trailers) {
                final long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
                LOGGER.debug("Call {} completed with {} in {} ms", method, status.getCode(), elapsedMs);
                super.close(status, trailers);
            }
        }, headers);
    }
}
