package com.taskagent.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ToolExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a shell command in the working directory and captures its combined
 * output. A command that exits non-zero or times out is a failed result.
 */
public class RunCommandTool extends WorkspaceTool {

    private static final Logger log = LoggerFactory.getLogger(RunCommandTool.class);

    private static final int DEFAULT_TIMEOUT_SECONDS = 60;

    record Arguments(
        @JsonProperty("command") String command,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds
    ) {
        Arguments {
            require(command, "command");
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds < 1 ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
        }
    }

    public RunCommandTool(Path workingDirectory) {
        super("run_command", "Run a shell command in the working directory", workingDirectory);
    }

    @Override
    public ToolResult execute(Map<String, Object> args) throws ToolExecutionException {
        Arguments arguments = arguments(args, Arguments.class);
        log.info("Running command: {}", arguments.command());

        Process process;
        try {
            process = new ProcessBuilder(shell(arguments.command()))
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            return ToolResult.failure("Failed to start command: " + e.getMessage());
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(arguments.timeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return ToolResult.failure("Command timed out after " + arguments.timeoutSeconds() + "s");
            }
            int exitCode = process.exitValue();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("exit_code", exitCode);
            data.put("output", output.get(5, TimeUnit.SECONDS));
            return exitCode == 0
                ? ToolResult.ok("Command succeeded", data)
                : new ToolResult(false, "Command exited with code " + exitCode, data);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("INTERRUPTED", "Interrupted while running command", e);
        } catch (ExecutionException | TimeoutException e) {
            return ToolResult.failure("Failed to read command output: " + e.getMessage());
        }
    }

    private static List<String> shell(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        return windows ? List.of("cmd.exe", "/c", command) : List.of("sh", "-c", command);
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
