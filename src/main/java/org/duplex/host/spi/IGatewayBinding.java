package org.duplex.host.spi;

import io.grpc.Channel;
import io.grpc.Context;
import org.duplex.host.gateway.GatewayRoutes;

/**
 * Registers the HTTP routes of one service on the gateway. Invoked once per host run, after the
 * binary listener is bound and before the HTTP listener starts.
 */
@FunctionalInterface
public interface IGatewayBinding {

    /**
     * Registers routes that translate HTTP requests into calls on the loopback channel.
     *
     * @param context  The host's cancellation context for this run.
     * @param routes   The gateway route table.
     * @param loopback The shared client channel into the host's own binary listener. It is shared by
     *                 every route of every service and must not be closed by a binding.
     * @throws Exception if the routes cannot be registered. The host treats this as a startup failure.
     */
    void bind(Context context, GatewayRoutes routes, Channel loopback) throws Exception;
}
