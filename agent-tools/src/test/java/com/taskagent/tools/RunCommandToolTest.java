package com.taskagent.tools;

import com.taskagent.core.model.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class RunCommandToolTest {

    @TempDir
    Path workspace;

    @Test
    void execute_shouldCaptureOutputInWorkingDirectory() throws Exception {
        Files.writeString(workspace.resolve("marker.txt"), "");

        ToolResult result = new RunCommandTool(workspace).execute(Map.of("command", "echo hello && ls"));

        assertThat(result.success()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.data();
        assertThat(data).containsEntry("exit_code", 0);
        assertThat((String) data.get("output")).contains("hello").contains("marker.txt");
    }

    @Test
    void execute_nonZeroExit_shouldFail() throws Exception {
        ToolResult result = new RunCommandTool(workspace).execute(Map.of("command", "exit 3"));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Command exited with code 3");
    }

    @Test
    void execute_slowCommand_shouldTimeOut() throws Exception {
        ToolResult result = new RunCommandTool(workspace)
            .execute(Map.of("command", "sleep 5", "timeout_seconds", 1));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Command timed out after 1s");
    }
}
