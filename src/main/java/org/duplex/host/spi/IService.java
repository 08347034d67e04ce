package org.duplex.host.spi;

/**
 * Defines the contract for a business service hosted by the {@link org.duplex.host.ServiceHost}.
 * The service owns its implementation; the host only keeps a reference to it while it is registered
 * and reads its {@link ServiceDescriptor} to bind it to the binary listener and the gateway.
 */
public interface IService {

    /**
     * Describes the service: its identity, its gRPC method bindings and its optional gateway bindings.
     * The host may call this more than once, so implementations should return an equivalent
     * descriptor on every call.
     *
     * @return The descriptor of this service, never null.
     */
    ServiceDescriptor describe();
}
