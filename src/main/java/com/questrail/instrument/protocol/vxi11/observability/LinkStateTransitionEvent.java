package com.questrail.instrument.protocol.vxi11.observability;

import com.questrail.instrument.protocol.vxi11.model.Link;
import com.questrail.instrument.protocol.vxi11.state.LinkState;

import java.time.Instant;

/**
 * Emitted whenever a link session changes state.
 *
 * @param link the link involved; {@code null} before {@code create_link} succeeded
 */
public record LinkStateTransitionEvent(
    Instant timestamp,
    String host,
    String device,
    LinkState oldState,
    LinkState newState,
    Link link
) {
}
