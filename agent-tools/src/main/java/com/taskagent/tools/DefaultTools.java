package com.taskagent.tools;

import com.taskagent.core.spi.Tool;

import java.nio.file.Path;
import java.util.List;

/**
 * The built-in tool set.
 */
public final class DefaultTools {

    private DefaultTools() {
    }

    /**
     * Create the built-in tools rooted at a working directory.
     */
    public static List<Tool> create(Path workingDirectory) {
        return List.of(
            new ReadFileTool(workingDirectory),
            new WriteFileTool(workingDirectory),
            new SearchFilesTool(workingDirectory),
            new ListFilesTool(workingDirectory),
            new ReplaceInFileTool(workingDirectory),
            new RunCommandTool(workingDirectory)
        );
    }
}
