package org.duplex.host;

/**
 * Thrown when a service cannot be registered because its descriptor is unusable. The host is left
 * unchanged, so the caller may fix the service and register it again.
 */
public class ConfigurationException extends HostException {

    /**
     * The descriptor condition that failed.
     */
    public enum Reason {
        /** The descriptor reports itself as invalid. */
        INVALID_DESCRIPTOR,
        /** The descriptor has no gRPC method bindings. */
        NO_METHOD_BINDINGS
    }

    private final Reason reason;
    private final String serviceIdentity;

    public ConfigurationException(final Reason reason, final String serviceIdentity, final String message) {
        super(message);
        this.reason = reason;
        this.serviceIdentity = serviceIdentity;
    }

    public Reason getReason() {
        return reason;
    }

    public String getServiceIdentity() {
        return serviceIdentity;
    }
}
