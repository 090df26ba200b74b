package com.questrail.hamgateway.observability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GatewayObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        record(event);
    }

    @Override
    public synchronized void onSourceRejected(SourceRejectedEvent event) {
        record(event);
    }

    @Override
    public synchronized void onMessageDropped(MessageDroppedEvent event) {
        record(event);
    }

    @Override
    public synchronized void onError(GatewayErrorEvent event) {
        record(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<SourceRejectedEvent> rejections(SourceRejectedEvent.Reason reason) {
        return eventsOfType(SourceRejectedEvent.class).stream()
            .filter(e -> e.reason() == reason)
            .collect(Collectors.toList());
    }

    public synchronized List<MessageDroppedEvent> drops(MessageDroppedEvent.Reason reason) {
        return eventsOfType(MessageDroppedEvent.class).stream()
            .filter(e -> e.reason() == reason)
            .collect(Collectors.toList());
    }

    public synchronized List<TransportObservabilityEvent> transportEvents(TransportObservabilityEvent.Kind kind) {
        return eventsOfType(TransportObservabilityEvent.class).stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized List<GatewayErrorEvent> errors() {
        return eventsOfType(GatewayErrorEvent.class);
    }

    /**
     * Waits for the first event of {@code type} matching {@code match}.
     */
    public synchronized <T> Optional<T> awaitEvent(Class<T> type, Predicate<? super T> match, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<T> found = events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .filter(match)
                .findFirst();
            if (found.isPresent()) {
                return found;
            }
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                return Optional.empty();
            }
            wait(remainingMillis);
        }
    }

    private void record(Object event) {
        events.add(event);
        notifyAll();
    }
}
