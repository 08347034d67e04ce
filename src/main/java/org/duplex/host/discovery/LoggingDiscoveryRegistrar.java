package org.duplex.host.discovery;

import com.typesafe.config.Config;
import org.duplex.host.spi.IDiscoveryRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Announces each node in the log instead of a registry. This is the registrar standalone hosts use
 * when no real registry is configured.
 */
public class LoggingDiscoveryRegistrar implements IDiscoveryRegistrar {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiscoveryRegistrar.class);

    public LoggingDiscoveryRegistrar() {
    }

    public LoggingDiscoveryRegistrar(final Config options) {
        this();
    }

    @Override
    public void register(final Node node) {
        LOGGER.info("Service '{}' reachable over {} at {}", node.serviceIdentity(), node.protocol(), node.address());
    }
}
