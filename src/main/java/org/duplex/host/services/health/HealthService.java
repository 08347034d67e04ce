package org.duplex.host.services.health;

import com.typesafe.config.Config;
import io.grpc.Channel;
import io.grpc.Context;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.protobuf.services.HealthStatusManager;
import io.javalin.http.HandlerType;
import org.duplex.host.gateway.GatewayRoutes;
import org.duplex.host.services.AbstractHostedService;
import org.duplex.host.spi.ServiceDescriptor;

import java.util.List;

/**
 * Serves the standard {@code grpc.health.v1.Health} service and mirrors its {@code Check} method on
 * the gateway at {@code GET /v1/health} (overall status) and {@code GET /v1/health/{service}}.
 *
 * <p>Options: {@code serviceNames}, the service names reported as {@code SERVING} in addition to the
 * overall server status.</p>
 */
public class HealthService extends AbstractHostedService {

    static final String HEALTH_PATH = "/v1/health";

    private final HealthStatusManager statusManager = new HealthStatusManager();

    public HealthService(final String serviceName, final Config options) {
        super(serviceName, options);
        statusManager.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.SERVING);
        final List<String> serviceNames = this.options.hasPath("serviceNames")
            ? this.options.getStringList("serviceNames")
            : List.of();
        for (final String name : serviceNames) {
            statusManager.setStatus(name, ServingStatus.SERVING);
        }
    }

    @Override
    public ServiceDescriptor describe() {
        return ServiceDescriptor.builder(serviceName)
            .methodBinding(statusManager.getHealthService())
            .gatewayBinding(this::bindGateway)
            .build();
    }

    /**
     * Changes the reported status of one service.
     *
     * @param service The service name; empty for the overall server status.
     * @param status  The new status.
     */
    public void setStatus(final String service, final ServingStatus status) {
        statusManager.setStatus(service, status);
    }

    private void bindGateway(final Context context, final GatewayRoutes routes, final Channel loopback) {
        routes.unary(HandlerType.GET, HEALTH_PATH, HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), loopback);
        routes.unary(HandlerType.GET, HEALTH_PATH + "/{service}", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), loopback);
    }
}
