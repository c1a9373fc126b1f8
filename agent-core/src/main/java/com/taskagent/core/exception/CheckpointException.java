package com.taskagent.core.exception;

/**
 * Thrown when a checkpoint cannot be created or restored.
 */
public class CheckpointException extends AgentException {

    public static final String ERROR_CODE = "CHECKPOINT_ERROR";

    public CheckpointException(String message) {
        super(ERROR_CODE, message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected CheckpointException(String errorCode, String message) {
        super(errorCode, message);
    }
}
