package com.taskagent.core.exception;

/**
 * Thrown when the oracle requests a tool that is not registered.
 */
public class UnknownToolException extends AgentException {

    public static final String ERROR_CODE = "UNKNOWN_TOOL";

    private final String toolName;

    public UnknownToolException(String toolName) {
        super(ERROR_CODE, "Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
