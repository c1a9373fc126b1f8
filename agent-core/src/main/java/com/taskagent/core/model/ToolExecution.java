package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Record of a tool that was executed on behalf of the oracle.
 */
public record ToolExecution(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("args") Map<String, Object> args,
    @JsonProperty("result") ToolResult result,
    @JsonProperty("timestamp") Instant timestamp
) {
    public ToolExecution {
        args = Collections2.copyOf(args);
    }
}
