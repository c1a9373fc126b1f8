package com.taskagent.core.exception;

/**
 * Thrown when a breakpoint condition cannot be parsed.
 */
public class InvalidConditionException extends AgentException {

    public static final String ERROR_CODE = "INVALID_BREAKPOINT_CONDITION";

    public InvalidConditionException(String condition, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid breakpoint condition '%s': %s",
            condition, reason
        ));
    }
}
