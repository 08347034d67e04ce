package org.duplex.host;

/**
 * Thrown when an operation is attempted in a phase that does not allow it, e.g. registering a service
 * on a host that is already running.
 */
public class HostPhaseException extends IllegalStateException {

    private final HostPhase phase;

    public HostPhaseException(final String operation, final HostPhase phase) {
        super(String.format("Cannot %s as the host is in phase %s", operation, phase));
        this.phase = phase;
    }

    public HostPhase getPhase() {
        return phase;
    }
}
