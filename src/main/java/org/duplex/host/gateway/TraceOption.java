package org.duplex.host.gateway;

import java.util.List;

/**
 * Tracing configuration handed to the gateway's trace injector.
 *
 * @param enabled Whether trace context should be propagated at all.
 * @param headers The HTTP headers carrying trace context, forwarded verbatim as gRPC metadata.
 */
public record TraceOption(boolean enabled, List<String> headers) {

    public static final List<String> DEFAULT_HEADERS = List.of("traceparent", "tracestate");

    public TraceOption {
        headers = headers != null ? List.copyOf(headers) : List.of();
    }

    public static TraceOption disabled() {
        return new TraceOption(false, DEFAULT_HEADERS);
    }
}
