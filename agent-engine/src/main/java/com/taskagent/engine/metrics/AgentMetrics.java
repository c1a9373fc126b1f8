package com.taskagent.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer metrics for task execution.
 *
 * Metrics exposed:
 * - Task counts by outcome and task duration
 * - Tool executions by tool and outcome, tool rejections
 * - Checkpoints created, oracle errors
 * - Rate limiter waits
 */
public class AgentMetrics implements MeterBinder {

    public static final String TASKS_STARTED = "agent.tasks.started";
    public static final String TASKS_COMPLETED = "agent.tasks.completed";
    public static final String TASKS_FAILED = "agent.tasks.failed";
    public static final String TASK_DURATION = "agent.task.duration";

    public static final String TOOL_EXECUTIONS = "agent.tool.executions";
    public static final String TOOL_REJECTIONS = "agent.tool.rejections";

    public static final String CHECKPOINTS_CREATED = "agent.checkpoints.created";
    public static final String ORACLE_ERRORS = "agent.oracle.errors";
    public static final String RATE_LIMIT_WAIT = "agent.ratelimit.wait";

    // In-memory until bound to the application's registry
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Task Metrics ==========

    public void taskStarted() {
        Counter.builder(TASKS_STARTED)
            .description("Total tasks started")
            .register(registry)
            .increment();
    }

    public void taskCompleted(Duration duration) {
        Counter.builder(TASKS_COMPLETED)
            .description("Total tasks completed successfully")
            .register(registry)
            .increment();
        recordDuration(duration, "success");
    }

    public void taskFailed(String errorType, Duration duration) {
        Counter.builder(TASKS_FAILED)
            .tag("error_type", errorType)
            .description("Total tasks failed")
            .register(registry)
            .increment();
        recordDuration(duration, "failure");
    }

    // ========== Tool Metrics ==========

    public void toolExecuted(String toolName, boolean success) {
        Counter.builder(TOOL_EXECUTIONS)
            .tag("tool", toolName)
            .tag("outcome", success ? "success" : "failure")
            .description("Tool executions")
            .register(registry)
            .increment();
    }

    public void toolRejected(String toolName) {
        Counter.builder(TOOL_REJECTIONS)
            .tag("tool", toolName)
            .description("Tool calls rejected by the approval gate")
            .register(registry)
            .increment();
    }

    // ========== Checkpoint / Oracle Metrics ==========

    public void checkpointCreated() {
        Counter.builder(CHECKPOINTS_CREATED)
            .description("Checkpoints created")
            .register(registry)
            .increment();
    }

    public void oracleError() {
        Counter.builder(ORACLE_ERRORS)
            .description("Failed oracle calls")
            .register(registry)
            .increment();
    }

    public void rateLimitWaited(Duration wait) {
        Timer.builder(RATE_LIMIT_WAIT)
            .description("Time spent waiting for the oracle rate limit")
            .register(registry)
            .record(wait);
    }

    private void recordDuration(Duration duration, String outcome) {
        if (duration == null) {
            return;
        }
        Timer.builder(TASK_DURATION)
            .tag("outcome", outcome)
            .description("Task execution duration")
            .register(registry)
            .record(duration);
    }
}
