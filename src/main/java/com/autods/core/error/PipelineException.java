package com.autods.core.error;

/**
 * Base class for failures that abort a run.
 * <p>
 * Nothing in the pipeline retries a failed stage; these propagate to the caller.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
