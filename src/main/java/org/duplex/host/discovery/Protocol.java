package org.duplex.host.discovery;

/**
 * The transports a service can be advertised on.
 */
public enum Protocol {
    RPC,
    HTTP
}
