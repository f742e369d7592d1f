package com.autods.core.error;

/**
 * Thrown when a candidate model fails to fit or predict. Aborts the whole iteration.
 */
public class ModelException extends PipelineException {
    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
