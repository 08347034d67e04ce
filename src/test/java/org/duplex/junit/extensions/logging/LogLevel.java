package org.duplex.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels the watch annotations can name.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(final Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
