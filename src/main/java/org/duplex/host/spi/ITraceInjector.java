package org.duplex.host.spi;

import io.javalin.http.Context;
import org.duplex.host.gateway.GatewayCallContext;
import org.duplex.host.gateway.TraceOption;

/**
 * Request-scoped hook the gateway invokes before dispatching each HTTP request. Implementations
 * read tracing information from the request and add it to the outbound call context so that it
 * travels with the loopback call.
 */
@FunctionalInterface
public interface ITraceInjector {

    /**
     * Leaves the request untouched.
     */
    ITraceInjector NOOP = (request, call, option) -> { };

    /**
     * @param request The inbound HTTP request.
     * @param call    The outbound call context of this request.
     * @param option  The tracing configuration of the host.
     */
    void inject(Context request, GatewayCallContext call, TraceOption option);
}
