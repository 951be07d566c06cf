package com.questrail.instrument.protocol.vxi11.observability;

import java.time.Instant;

/**
 * Connection-level events of the core and abort channels.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    String host,
    int port,
    Kind kind
) {
    public enum Kind {
        PORT_RESOLVED,
        CORE_CONNECTED,
        CORE_CLOSED,
        ABORT_CONNECTED,
        ABORT_CLOSED
    }
}
