package com.questrail.instrument.protocol.vxi11.observability;

/**
 * No-op implementation of Vxi11ObservabilitySink.
 */
public final class NullObservabilitySink implements Vxi11ObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {}

    @Override
    public void onStrayReply(StrayReplyEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(Vxi11ErrorEvent event) {}
}
