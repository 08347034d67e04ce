package org.duplex.host.spi;

import java.util.Optional;

/**
 * Resolves the host string advertised in discovery records.
 */
@FunctionalInterface
public interface IHostAddressResolver {

    /**
     * @return The reachable address of this process, or empty if none could be determined.
     */
    Optional<String> resolve();
}
