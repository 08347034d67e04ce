package org.duplex.host.discovery;

import java.util.Objects;

/**
 * A discovery record advertising one service's reachability over one transport.
 *
 * @param host            The advertised host address.
 * @param port            The bound port of the transport.
 * @param protocol        The transport the node is reachable over.
 * @param serviceIdentity The identity of the advertised service.
 */
public record Node(String host, int port, Protocol protocol, String serviceIdentity) {

    public Node {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(serviceIdentity, "serviceIdentity");
    }

    /**
     * @return The {@code host:port} address of this node.
     */
    public String address() {
        return host + ":" + port;
    }
}
