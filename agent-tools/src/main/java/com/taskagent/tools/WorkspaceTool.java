package com.taskagent.tools;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.core.spi.Tool;
import com.taskagent.core.spi.ToolExecutionException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Base for tools that operate inside a working directory.
 *
 * Paths given by the oracle are resolved against the working directory and
 * must stay inside it.
 */
public abstract class WorkspaceTool implements Tool {

    private static final ObjectMapper ARGUMENT_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final String name;
    private final String description;
    protected final Path workingDirectory;

    protected WorkspaceTool(String name, String description, Path workingDirectory) {
        this.name = name;
        this.description = description;
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    /**
     * Bind the raw arguments to a typed argument record.
     *
     * @throws ToolExecutionException if required arguments are missing or malformed
     */
    protected <T> T arguments(Map<String, Object> args, Class<T> type) throws ToolExecutionException {
        try {
            return ARGUMENT_MAPPER.convertValue(args, type);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null && e.getCause().getCause() != null
                ? e.getCause().getCause()
                : e;
            throw ToolExecutionException.invalidArguments(name + ": " + cause.getMessage());
        }
    }

    /**
     * Resolve a path against the working directory.
     *
     * @throws ToolExecutionException if the path leaves the working directory
     */
    protected Path resolve(String path) throws ToolExecutionException {
        Path resolved = workingDirectory.resolve(path).normalize();
        if (!resolved.startsWith(workingDirectory)) {
            throw new ToolExecutionException("PATH_OUTSIDE_WORKSPACE",
                "Path is outside the working directory: " + path);
        }
        return resolved;
    }

    /**
     * Path relative to the working directory, with forward slashes.
     */
    protected String relativize(Path path) {
        return workingDirectory.relativize(path).toString().replace('\\', '/');
    }

    static String require(String value, String argument) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing required argument '" + argument + "'");
        }
        return value;
    }
}
