package org.duplex.host;

/**
 * Base class of the checked failures reported by a {@link ServiceHost}.
 */
public abstract class HostException extends Exception {

    protected HostException(String message) {
        super(message);
    }

    protected HostException(String message, Throwable cause) {
        super(message, cause);
    }
}
