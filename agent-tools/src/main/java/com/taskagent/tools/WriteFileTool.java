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
 * Writes a UTF-8 text file, replacing any existing content.
 */
public class WriteFileTool extends WorkspaceTool {

    record Arguments(
        @JsonProperty("path") String path,
        @JsonProperty("content") String content,
        @JsonProperty("create_dirs") Boolean createDirs
    ) {
        Arguments {
            require(path, "path");
            if (content == null) {
                throw new IllegalArgumentException("missing required argument 'content'");
            }
            createDirs = createDirs == null || createDirs;
        }
    }

    public WriteFileTool(Path workingDirectory) {
        super("write_file", "Write content to a file at the specified path", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Arguments arguments = arguments(args, Arguments.class);
        Path path = resolve(arguments.path());
        try {
            if (arguments.createDirs() && path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, arguments.content(), StandardCharsets.UTF_8);
            return ToolResult.ok("Content written to " + relativize(path));
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }
}
