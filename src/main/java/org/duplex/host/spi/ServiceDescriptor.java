package org.duplex.host.spi;

import io.grpc.BindableService;
import io.grpc.ServerServiceDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Metadata a service exposes to the host.
 *
 * @param name            The service identity advertised in discovery records.
 * @param valid           Whether the service considers itself ready to be hosted.
 * @param methodBindings  The gRPC service definitions bound to the binary listener, in order.
 * @param gatewayBindings The functions that register HTTP routes for this service, in order.
 */
public record ServiceDescriptor(String name,
                                boolean valid,
                                List<ServerServiceDefinition> methodBindings,
                                List<IGatewayBinding> gatewayBindings) {

    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        methodBindings = methodBindings != null ? List.copyOf(methodBindings) : List.of();
        gatewayBindings = gatewayBindings != null ? List.copyOf(gatewayBindings) : List.of();
    }

    /**
     * Starts a descriptor for a valid service with the given identity.
     *
     * @param name The service identity.
     * @return A new builder.
     */
    public static Builder builder(final String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder for {@link ServiceDescriptor}.
     */
    public static final class Builder {
        private final String name;
        private boolean valid = true;
        private final List<ServerServiceDefinition> methodBindings = new ArrayList<>();
        private final List<IGatewayBinding> gatewayBindings = new ArrayList<>();

        private Builder(final String name) {
            this.name = name;
        }

        public Builder valid(final boolean valid) {
            this.valid = valid;
            return this;
        }

        public Builder methodBinding(final ServerServiceDefinition definition) {
            methodBindings.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public Builder methodBinding(final BindableService service) {
            return methodBinding(service.bindService());
        }

        public Builder gatewayBinding(final IGatewayBinding binding) {
            gatewayBindings.add(Objects.requireNonNull(binding, "binding"));
            return this;
        }

        public ServiceDescriptor build() {
            return new ServiceDescriptor(name, valid, methodBindings, gatewayBindings);
        }
    }
}
