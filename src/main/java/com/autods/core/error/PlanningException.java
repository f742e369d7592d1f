package com.autods.core.error;

/**
 * Thrown when a run cannot be planned: no target could be inferred or run parameters are invalid.
 */
public class PlanningException extends PipelineException {
    public PlanningException(String message) {
        super(message);
    }
}
