package org.duplex.host.discovery;

import org.duplex.host.spi.IHostAddressResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the advertised address by enumerating the network interfaces of this machine.
 *
 * <p>Only interfaces that are up, not loopback and not virtual are considered. Among their
 * addresses, site-local IPv4 addresses win over other IPv4 addresses, which win over IPv6.
 * Link-local addresses are never advertised.</p>
 */
public final class NetworkInterfaceAddressResolver implements IHostAddressResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkInterfaceAddressResolver.class);

    @Override
    public Optional<String> resolve() {
        final List<InetAddress> candidates = new ArrayList<>();
        try {
            for (final NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback() || nic.isVirtual()) {
                    continue;
                }
                for (final InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (!address.isLoopbackAddress() && !address.isLinkLocalAddress() && !address.isAnyLocalAddress()) {
                        candidates.add(address);
                    }
                }
            }
        } catch (final SocketException e) {
            LOGGER.warn("Could not enumerate network interfaces: {}", e.getMessage());
            return Optional.empty();
        }

        candidates.sort(Comparator.comparingInt(NetworkInterfaceAddressResolver::rank));
        final Optional<String> resolved = candidates.stream().findFirst().map(NetworkInterfaceAddressResolver::hostAddress);
        LOGGER.debug("Resolved advertised address {} from {} candidate(s)", resolved.orElse("<none>"), candidates.size());
        return resolved;
    }

    private static String hostAddress(final InetAddress address) {
        final String host = address.getHostAddress();
        final int scope = host.indexOf('%');
        return scope >= 0 ? host.substring(0, scope) : host;
    }

    private static int rank(final InetAddress address) {
        if (address instanceof Inet4Address) {
            return address.isSiteLocalAddress() ? 0 : 1;
        }
        return 2;
    }
}
