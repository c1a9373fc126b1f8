package com.taskagent.core.model;

/**
 * Lifecycle states of a task run by the agent engine.
 */
public enum TaskStatus {
    /**
     * No task has been started yet.
     * Transitions: -> RUNNING
     */
    INIT,

    /**
     * The control loop is iterating.
     * Transitions: -> COMPLETE, FAILED
     */
    RUNNING,

    /**
     * The oracle signalled completion. Terminal state.
     */
    COMPLETE,

    /**
     * The task ended with an error or exhausted its iteration budget. Terminal state.
     */
    FAILED;

    /**
     * Check if this state is terminal (the loop must not continue).
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case INIT -> target == RUNNING;
            case RUNNING -> target == COMPLETE || target == FAILED;
            // a terminal task can only be replaced by a new run
            case COMPLETE, FAILED -> target == RUNNING;
        };
    }
}
