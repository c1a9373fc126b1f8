package com.taskagent.core.spi;

/**
 * Exception thrown by tools that cannot complete an invocation.
 * The engine downgrades it to a failed tool result.
 */
public class ToolExecutionException extends Exception {

    private final String errorCode;

    public ToolExecutionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ToolExecutionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Create an exception for arguments the tool cannot accept.
     */
    public static ToolExecutionException invalidArguments(String message) {
        return new ToolExecutionException("INVALID_ARGUMENTS", message);
    }
}
