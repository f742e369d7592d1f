package com.autods.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run events.
 * <p>
 * Subscribers receive the events of every run. A failing subscriber is logged and never interrupts the run.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<RunEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(RunEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());
        globalSubscribers.forEach(subscriber -> deliverSafely(subscriber, event));
    }

    /**
     * Subscribe to events from all runs.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RunEvent> subscriber, RunEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
