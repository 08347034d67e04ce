package org.duplex.host.spi;

import org.duplex.host.discovery.DiscoveryException;
import org.duplex.host.discovery.Node;

/**
 * The system of record that stores {@link Node} advertisements. The host submits each node once;
 * retries, heartbeats and deregistration are the registrar's own concern.
 */
public interface IDiscoveryRegistrar {

    /**
     * Advertises one service's reachability over one transport.
     *
     * @param node The node record.
     * @throws DiscoveryException if the registrar rejects or cannot store the record.
     */
    void register(Node node) throws DiscoveryException;
}
