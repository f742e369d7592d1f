package com.autods.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String ITERATION = "iteration";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setIteration(String runId, int iteration) {
        MDC.put(RUN_ID, runId);
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(ITERATION);
    }
}
