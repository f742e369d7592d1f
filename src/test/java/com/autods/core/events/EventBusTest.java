package com.autods.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @Test
    @DisplayName("global subscribers see every run")
    void global() {
        List<RunEvent> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        bus.publish(RunEvent.of(RunEvent.RUN_CREATED, "run-a", 0, Map.of()));
        bus.publish(RunEvent.of(RunEvent.ITERATION_COMPLETED, "run-b", 1, Map.of("bestModel", "Logistic")));

        assertEquals(2, received.size());
        assertEquals(1, received.get(1).iteration());
        assertEquals("Logistic", received.get(1).payload().get("bestModel"));
    }

    @Test
    @DisplayName("unsubscribe stops delivery")
    void unsubscribe() {
        List<RunEvent> dropped = new ArrayList<>();
        List<RunEvent> kept = new ArrayList<>();
        EventBus.Subscription sub = bus.subscribeAll(dropped::add);
        bus.subscribeAll(kept::add);

        sub.unsubscribe();
        bus.publish(RunEvent.of(RunEvent.RUN_COMPLETED, "run-a", 1, Map.of()));

        assertTrue(dropped.isEmpty());
        assertEquals(1, kept.size());
    }

    @Test
    @DisplayName("a failing subscriber does not block the others")
    void failingSubscriber() {
        List<RunEvent> received = new ArrayList<>();
        bus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> bus.publish(RunEvent.of(RunEvent.REPLAN_STARTED, "run-a", 1, Map.of())));
        assertEquals(1, received.size());
    }
}
