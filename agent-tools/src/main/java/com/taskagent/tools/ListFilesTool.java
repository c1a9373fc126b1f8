package com.taskagent.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ToolExecutionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lists regular files in a directory, optionally recursively. Paths are
 * returned relative to the working directory, sorted.
 */
public class ListFilesTool extends WorkspaceTool {

    record Arguments(
        @JsonProperty("directory") String directory,
        @JsonProperty("recursive") boolean recursive
    ) {
        Arguments {
            directory = directory == null || directory.isBlank() ? "." : directory;
        }
    }

    public ListFilesTool(Path workingDirectory) {
        super("list_files", "List files in a directory", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Arguments arguments = arguments(args, Arguments.class);
        Path directory = resolve(arguments.directory());
        if (!Files.isDirectory(directory)) {
            return ToolResult.failure("Directory not found: " + arguments.directory());
        }
        try (Stream<Path> paths = arguments.recursive() ? Files.walk(directory) : Files.list(directory)) {
            List<String> files = paths
                .filter(Files::isRegularFile)
                .map(this::relativize)
                .sorted()
                .toList();
            return ToolResult.ok("Listed " + files.size() + " files", files);
        } catch (IOException e) {
            return ToolResult.failure("Failed to list files: " + e.getMessage());
        }
    }
}
