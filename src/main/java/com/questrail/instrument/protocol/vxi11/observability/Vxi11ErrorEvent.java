package com.questrail.instrument.protocol.vxi11.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the VXI-11 client stack.
 */
public record Vxi11ErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
