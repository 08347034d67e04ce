package org.duplex.host.gateway;

import io.javalin.http.Context;
import org.duplex.host.spi.ITraceInjector;

/**
 * Propagates trace context by copying the configured trace headers of the HTTP request into the
 * outbound gRPC metadata, e.g. W3C {@code traceparent} and {@code tracestate}.
 */
public class TraceHeaderInjector implements ITraceInjector {

    @Override
    public void inject(final Context request, final GatewayCallContext call, final TraceOption option) {
        if (option == null || !option.enabled()) {
            return;
        }
        for (final String header : option.headers()) {
            final String value = request.header(header);
            if (value != null && !value.isBlank()) {
                call.putHeader(header, value);
            }
        }
    }
}
