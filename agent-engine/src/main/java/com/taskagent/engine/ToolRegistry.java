package com.taskagent.engine;

import com.taskagent.core.exception.UnknownToolException;
import com.taskagent.core.spi.Tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools available to an engine, keyed by name. Registering a tool under an
 * existing name replaces it.
 */
public class ToolRegistry {

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry() {
    }

    public ToolRegistry(Collection<? extends Tool> initial) {
        initial.forEach(this::register);
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * @throws UnknownToolException if no tool has the name
     */
    public Tool require(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    /**
     * Registered tool names, sorted.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(tools.keySet());
        names.sort(null);
        return names;
    }
}
