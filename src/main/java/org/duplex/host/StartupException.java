package org.duplex.host;

/**
 * Thrown by {@link ServiceHost#run} when the host cannot reach a fully initialised state: the
 * advertised address cannot be resolved, a listener cannot bind, the loopback channel cannot be
 * dialed, a gateway binding fails or discovery registration fails.
 *
 * <p>Startup failures are fatal. The host releases whatever it had opened before throwing, and
 * callers are expected to terminate the process rather than retry.</p>
 */
public class StartupException extends HostException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
