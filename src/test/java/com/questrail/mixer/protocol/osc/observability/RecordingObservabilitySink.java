package com.questrail.mixer.protocol.osc.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MixerObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onSessionEvent(MixerSessionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onQueryEvent(MixerQueryEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(MixerTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(MixerErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<MixerQueryEvent.Outcome> queryOutcomes(String address) {
        return events.stream()
            .filter(e -> e instanceof MixerQueryEvent)
            .map(e -> (MixerQueryEvent) e)
            .filter(e -> e.address().equals(address))
            .map(MixerQueryEvent::outcome)
            .collect(Collectors.toList());
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
