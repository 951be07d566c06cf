package com.questrail.instrument.protocol.vxi11.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements Vxi11ObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(LinkStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStrayReply(StrayReplyEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(Vxi11ErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<LinkStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof LinkStateTransitionEvent)
            .map(e -> (LinkStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
