package com.autods.core.error;

/**
 * Thrown when a dataset cannot be read, is empty, or lacks the requested target column.
 */
public class DataException extends PipelineException {
    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
