package com.questrail.instrument.protocol.vxi11.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of Vxi11ObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jVxi11ObservabilitySink implements Vxi11ObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jVxi11ObservabilitySink.class);

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {
        if (event.link() != null) {
            log.info("VXI-11 {} {}: {} -> {} (lid={}, abort_port={}, max_recv_size={})",
                event.host(),
                event.device(),
                event.oldState(),
                event.newState(),
                event.link().linkId(),
                event.link().abortPort(),
                event.link().maxRecvSize());
        }
        else {
            log.info("VXI-11 {} {}: {} -> {}",
                event.host(), event.device(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onStrayReply(StrayReplyEvent event) {
        log.debug("VXI-11 {}: discarded {}-byte reply, expected xid {}",
            event.host(), event.length(), Integer.toUnsignedString(event.expectedXid()));
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        log.info("VXI-11 Transport Event: {} {}:{}", event.kind(), event.host(), event.port());
    }

    @Override
    public void onError(Vxi11ErrorEvent event) {
        log.error("VXI-11 Error: {}", event.message(), event.cause());
    }
}
