package com.taskagent.core.exception;

/**
 * Thrown when a task reaches the iteration budget without completing.
 */
public class IterationLimitExceededException extends AgentException {

    public static final String ERROR_CODE = "ITERATION_LIMIT_EXCEEDED";

    private final int maxIterations;

    public IterationLimitExceededException(int maxIterations) {
        super(ERROR_CODE, "Task execution exceeded maximum iterations (" + maxIterations + ")");
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
