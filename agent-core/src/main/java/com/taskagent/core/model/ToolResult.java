package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a tool invocation. Ordinary failures are reported with
 * {@code success == false} rather than thrown.
 */
public record ToolResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("data") Object data
) {
    public static ToolResult ok(String message) {
        return new ToolResult(true, message, null);
    }

    public static ToolResult ok(String message, Object data) {
        return new ToolResult(true, message, data);
    }

    public static ToolResult failure(String message) {
        return new ToolResult(false, message, null);
    }
}
