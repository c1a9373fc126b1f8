package com.taskagent.core.exception;

/**
 * Thrown when the approval callback itself fails.
 */
public class ApprovalException extends AgentException {

    public static final String ERROR_CODE = "APPROVAL_FAILED";

    public ApprovalException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
