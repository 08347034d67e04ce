package org.duplex.host.discovery;

import org.duplex.host.spi.IHostAddressResolver;

import java.util.Optional;

/**
 * Advertises an explicitly configured address. A blank address resolves to empty.
 */
public final class StaticAddressResolver implements IHostAddressResolver {

    private final String address;

    public StaticAddressResolver(final String address) {
        this.address = address;
    }

    @Override
    public Optional<String> resolve() {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(address.trim());
    }

    @Override
    public String toString() {
        return "StaticAddressResolver[" + address + "]";
    }
}
