package com.taskagent.core.spi;

import com.taskagent.core.model.ToolResult;
import java.util.Map;

/**
 * A named, side-effecting operation the engine executes on the oracle's behalf.
 * Ordinary failures are returned as a failed {@link ToolResult}.
 */
public interface Tool {

    String name();

    String description();

    /**
     * Execute the tool.
     *
     * @param args Arguments chosen by the oracle
     * @return The tool result
     * @throws ToolExecutionException if the tool cannot run at all
     */
    ToolResult execute(Map<String, Object> args) throws ToolExecutionException;
}
