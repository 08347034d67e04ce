package org.duplex.host;

/**
 * Thrown by {@link ServiceHost#run} when a listener terminated for a reason other than a graceful
 * stop. Like startup failures, it is fatal for the process.
 */
public class ServingException extends HostException {

    public ServingException(String message, Throwable cause) {
        super(message, cause);
    }
}
