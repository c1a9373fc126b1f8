package com.taskagent.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ToolExecutionException;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Finds files whose name matches a glob pattern such as {@code *.java}.
 */
public class SearchFilesTool extends WorkspaceTool {

    record Arguments(
        @JsonProperty("directory") String directory,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("recursive") Boolean recursive
    ) {
        Arguments {
            directory = directory == null || directory.isBlank() ? "." : directory;
            require(pattern, "pattern");
            recursive = recursive == null || recursive;
        }
    }

    public SearchFilesTool(Path workingDirectory) {
        super("search_files", "Search for files whose name matches a glob pattern", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Arguments arguments = arguments(args, Arguments.class);
        Path directory = resolve(arguments.directory());
        if (!Files.isDirectory(directory)) {
            return ToolResult.failure("Directory not found: " + arguments.directory());
        }
        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + arguments.pattern());
        } catch (PatternSyntaxException e) {
            throw ToolExecutionException.invalidArguments("Invalid pattern: " + e.getMessage());
        }
        try (Stream<Path> paths = arguments.recursive() ? Files.walk(directory) : Files.list(directory)) {
            List<String> matches = paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .map(this::relativize)
                .sorted()
                .toList();
            return ToolResult.ok("Found " + matches.size() + " matches", matches);
        } catch (IOException e) {
            return ToolResult.failure("Search failed: " + e.getMessage());
        }
    }
}
