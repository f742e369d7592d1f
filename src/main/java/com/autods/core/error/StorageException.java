package com.autods.core.error;

/**
 * Thrown when the output directory, an artifact or the memory file cannot be written.
 */
public class StorageException extends PipelineException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
