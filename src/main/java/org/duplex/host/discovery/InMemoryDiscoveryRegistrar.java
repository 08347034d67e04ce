package org.duplex.host.discovery;

import com.typesafe.config.Config;
import org.duplex.host.spi.IDiscoveryRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A registrar that keeps every submitted node in memory. Useful for single-process deployments
 * where consumers look up nodes in the same JVM, and for tests.
 *
 * <p>Thread-safe: both serving units of a host register concurrently.</p>
 */
public class InMemoryDiscoveryRegistrar implements IDiscoveryRegistrar {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDiscoveryRegistrar.class);

    private final List<Node> nodes = new CopyOnWriteArrayList<>();

    public InMemoryDiscoveryRegistrar() {
    }

    /**
     * Reflective constructor used by the configuration layer. This registrar takes no options.
     *
     * @param options Ignored.
     */
    public InMemoryDiscoveryRegistrar(final Config options) {
        this();
    }

    @Override
    public void register(final Node node) throws DiscoveryException {
        if (node == null) {
            throw new DiscoveryException("Cannot register a null node.");
        }
        nodes.add(node);
        LOGGER.debug("Stored node {} for service '{}' at {}", node.protocol(), node.serviceIdentity(), node.address());
    }

    /**
     * @return A snapshot of all nodes in submission order.
     */
    public List<Node> getNodes() {
        return new ArrayList<>(nodes);
    }

    /**
     * @param protocol The transport to filter by.
     * @return The nodes advertised over the given transport, in submission order.
     */
    public List<Node> getNodes(final Protocol protocol) {
        return nodes.stream()
            .filter(node -> node.protocol() == protocol)
            .collect(Collectors.toList());
    }

    /**
     * @param serviceIdentity The service to look up.
     * @return The nodes advertised for the service, in submission order.
     */
    public List<Node> lookup(final String serviceIdentity) {
        return nodes.stream()
            .filter(node -> node.serviceIdentity().equals(serviceIdentity))
            .collect(Collectors.toList());
    }

    /**
     * Removes all stored nodes.
     */
    public void clear() {
        nodes.clear();
    }
}
