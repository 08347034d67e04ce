package org.duplex.host.discovery;

/**
 * Thrown when a discovery registrar cannot store a node record.
 */
public class DiscoveryException extends Exception {

    /**
     * @param message description of the failure.
     */
    public DiscoveryException(String message) {
        super(message);
    }

    /**
     * @param message description of the failure.
     * @param cause   the underlying cause.
     */
    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
