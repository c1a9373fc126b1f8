package com.taskagent.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ToolExecutionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a UTF-8 text file.
 */
public class ReadFileTool extends WorkspaceTool {

    record Arguments(@JsonProperty("path") String path) {
        Arguments {
            require(path, "path");
        }
    }

    public ReadFileTool(Path workingDirectory) {
        super("read_file", "Read contents of a file at the specified path", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Path path = resolve(arguments(args, Arguments.class).path());
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + relativize(path));
        }
        try {
            return ToolResult.ok("File read successfully", Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }
}
