package com.autods.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, used for CLI progress output.
 *
 * @param eventType event type (e.g. "run.created", "iteration.completed", "replan.started")
 * @param runId     the run this event belongs to
 * @param iteration 1-based iteration number, or 0 for run-level events
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RunEvent(
    String eventType,
    String runId,
    int iteration,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_CREATED = "run.created";
    public static final String ITERATION_COMPLETED = "iteration.completed";
    public static final String REPLAN_STARTED = "replan.started";
    public static final String RUN_COMPLETED = "run.completed";

    public static RunEvent of(String eventType, String runId, int iteration, Map<String, Object> payload) {
        return new RunEvent(eventType, runId, iteration, payload, Instant.now());
    }
}
