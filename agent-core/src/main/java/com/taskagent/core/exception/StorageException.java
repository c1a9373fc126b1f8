package com.taskagent.core.exception;

/**
 * Thrown when a storage backend fails to read or write state.
 */
public class StorageException extends AgentException {

    public static final String ERROR_CODE = "STORAGE_ERROR";

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
