package org.duplex.host.gateway;

import io.grpc.Metadata;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Per-request state the gateway carries from the HTTP request to the loopback call. It is created by
 * the gateway before any route runs and stored as a request attribute.
 *
 * <p>Not thread-safe; it belongs to exactly one request.</p>
 */
public final class GatewayCallContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayCallContext.class);

    static final String ATTRIBUTE = "duplex.gateway.call";

    private final Metadata outbound = new Metadata();

    /**
     * Returns the call context of the request, creating it if the request has none yet.
     *
     * @param request The HTTP request.
     * @return The call context bound to the request.
     */
    public static GatewayCallContext of(final Context request) {
        final GatewayCallContext existing = request.attribute(ATTRIBUTE);
        if (existing != null) {
            return existing;
        }
        final GatewayCallContext created = new GatewayCallContext();
        request.attribute(ATTRIBUTE, created);
        return created;
    }

    /**
     * Adds an ASCII header to the outbound metadata. Binary ({@code -bin}) keys and names that are not
     * valid metadata keys are ignored.
     *
     * @param name  The metadata key, case-insensitive.
     * @param value The value.
     * @return true if the header was added.
     */
    public boolean putHeader(final String name, final String value) {
        if (name == null || value == null) {
            return false;
        }
        final String key = name.toLowerCase(Locale.ROOT);
        if (key.isEmpty() || key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
            return false;
        }
        final Metadata.Key<String> metadataKey;
        try {
            metadataKey = Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
        } catch (final IllegalArgumentException e) {
            LOGGER.debug("Dropped header '{}': {}", name, e.getMessage());
            return false;
        }
        outbound.put(metadataKey, value);
        return true;
    }

    /**
     * @param name The metadata key, case-insensitive.
     * @return The last value added for the key, or null.
     */
    public String getHeader(final String name) {
        return outbound.get(Metadata.Key.of(name.toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER));
    }

    /**
     * @return A copy of the metadata to attach to the loopback call.
     */
    public Metadata getOutboundMetadata() {
        final Metadata copy = new Metadata();
        copy.merge(outbound);
        return copy;
    }
}
