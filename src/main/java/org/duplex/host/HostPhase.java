package org.duplex.host;

/**
 * The lifecycle phases of a {@link ServiceHost}. Phases only move forward.
 */
public enum HostPhase {
    /** No service registered yet. */
    CREATED,
    /** At least one service registered; the host has not run. */
    CONFIGURED,
    /** Listeners are starting or serving. */
    RUNNING,
    /** Cancellation observed; listeners are draining. */
    DRAINING,
    /** Both listeners have terminated. */
    STOPPED;

    /**
     * @return true if services may still be registered in this phase.
     */
    public boolean acceptsRegistration() {
        return this == CREATED || this == CONFIGURED;
    }
}
