package com.taskagent.core.exception;

/**
 * Thrown when restoring a checkpoint id that does not exist.
 */
public class CheckpointNotFoundException extends CheckpointException {

    public static final String ERROR_CODE = "CHECKPOINT_NOT_FOUND";

    public CheckpointNotFoundException(String checkpointId) {
        super(ERROR_CODE, "Checkpoint " + checkpointId + " not found");
    }
}
