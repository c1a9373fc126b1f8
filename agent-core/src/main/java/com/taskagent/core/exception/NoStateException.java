package com.taskagent.core.exception;

/**
 * Thrown when a checkpoint is requested for a task that has no saved state.
 */
public class NoStateException extends CheckpointException {

    public static final String ERROR_CODE = "NO_STATE";

    public NoStateException(String taskId) {
        super(ERROR_CODE, "No state found for task " + taskId);
    }
}
