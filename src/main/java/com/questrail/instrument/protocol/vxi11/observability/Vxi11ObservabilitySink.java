package com.questrail.instrument.protocol.vxi11.observability;

/**
 * Main interface for receiving VXI-11 client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface Vxi11ObservabilitySink {
    /**
     * Called when a link session changes state.
     * @param event the transition event details
     */
    void onStateTransition(LinkStateTransitionEvent event);

    /**
     * Called when an RPC reply with an unexpected transaction id is discarded.
     * @param event the discarded reply
     */
    void onStrayReply(StrayReplyEvent event);

    /**
     * Called when a transport-level event occurs (port resolved, channel up/down).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error is absorbed or about to be raised.
     * @param event the error event
     */
    void onError(Vxi11ErrorEvent event);
}
