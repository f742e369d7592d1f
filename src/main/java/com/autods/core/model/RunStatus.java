package com.autods.core.model;

/**
 * Lifecycle status of a run.
 * <p>
 * {@code REPLAN} is only entered from {@code REFLECTED} while replan budget remains.
 * There is no failed state: a stage failure propagates to the caller.
 */
public enum RunStatus {
    INIT,
    PROFILED,
    PLANNED,
    TRAINING,
    EVALUATED,
    REFLECTED,
    REPLAN,
    DONE
}
