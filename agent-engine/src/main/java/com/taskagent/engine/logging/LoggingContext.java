package com.taskagent.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of a task run carry the task id and a trace id.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId)) {
 *     log.info("Starting task"); // Automatically includes taskId, traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String TOOL_NAME = "toolName";
    public static final String ITERATION = "iteration";
    public static final String TRACE_ID = "traceId";

    private final boolean toolScope;

    private LoggingContext(boolean toolScope) {
        this.toolScope = toolScope;
    }

    /**
     * Create a logging context for a task run.
     */
    public static LoggingContext forTask(String taskId) {
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
        ensureTraceId();
        return new LoggingContext(false);
    }

    /**
     * Create a logging context for one tool call inside a task run.
     * Closing it keeps the task keys.
     */
    public static LoggingContext forTool(String toolName) {
        if (toolName != null) {
            MDC.put(TOOL_NAME, toolName);
        }
        return new LoggingContext(true);
    }

    /**
     * Record the current loop iteration.
     */
    public static void setIteration(int iteration) {
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TOOL_NAME);
        if (!toolScope) {
            MDC.remove(TASK_ID);
            MDC.remove(ITERATION);
        }
        // Keep TRACE_ID for request-scoped tracing
    }
}
