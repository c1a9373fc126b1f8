package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * The oracle's proposed next step: a tool invocation, a completion signal,
 * or neither (the iteration only records thoughts).
 */
public record Action(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("tool_args") Map<String, Object> toolArgs,
    @JsonProperty("is_complete") boolean complete,
    @JsonProperty("result") String result,
    @JsonProperty("thoughts") String thoughts
) {
    public Action {
        toolArgs = Collections2.copyOf(toolArgs);
    }

    public static Action useTool(String toolName, Map<String, Object> toolArgs, String thoughts) {
        return new Action(toolName, toolArgs, false, null, thoughts);
    }

    public static Action complete(String result, String thoughts) {
        return new Action(null, Map.of(), true, result, thoughts);
    }

    /**
     * An action that neither calls a tool nor completes the task.
     */
    public static Action thinking(String thoughts) {
        return new Action(null, Map.of(), false, null, thoughts);
    }

    @JsonIgnore
    public boolean hasTool() {
        return toolName != null && !toolName.isBlank();
    }
}
