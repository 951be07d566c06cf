package com.questrail.instrument.protocol.vxi11.observability;

import java.time.Instant;

/**
 * An RPC reply was discarded because its {@code xid} did not match the
 * outstanding call.
 */
public record StrayReplyEvent(
    Instant timestamp,
    String host,
    int expectedXid,
    int length
) {
}
