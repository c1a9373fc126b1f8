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
 * Replaces every occurrence of a literal string in a text file.
 */
public class ReplaceInFileTool extends WorkspaceTool {

    record Arguments(
        @JsonProperty("path") String path,
        @JsonProperty("search") String search,
        @JsonProperty("replace") String replace
    ) {
        Arguments {
            require(path, "path");
            if (search == null || search.isEmpty()) {
                throw new IllegalArgumentException("missing required argument 'search'");
            }
            replace = replace != null ? replace : "";
        }
    }

    public ReplaceInFileTool(Path workingDirectory) {
        super("replace_in_file", "Replace text in a file", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Arguments arguments = arguments(args, Arguments.class);
        Path path = resolve(arguments.path());
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + relativize(path));
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            int occurrences = countOccurrences(content, arguments.search());
            if (occurrences == 0) {
                return ToolResult.failure("Text not found in " + relativize(path));
            }
            Files.writeString(path, content.replace(arguments.search(), arguments.replace()), StandardCharsets.UTF_8);
            return ToolResult.ok("Replaced " + occurrences + " occurrence(s) in " + relativize(path),
                Map.of("replacements", occurrences));
        } catch (IOException e) {
            return ToolResult.failure("Failed to replace in file: " + e.getMessage());
        }
    }

    private static int countOccurrences(String content, String search) {
        int count = 0;
        int index = content.indexOf(search);
        while (index >= 0) {
            count++;
            index = content.indexOf(search, index + search.length());
        }
        return count;
    }
}
