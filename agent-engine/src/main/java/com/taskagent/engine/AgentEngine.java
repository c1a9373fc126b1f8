package com.taskagent.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.core.debug.BreakpointType;
import com.taskagent.core.debug.DebugInfo;
import com.taskagent.core.debug.DebugSession;
import com.taskagent.core.exception.AgentException;
import com.taskagent.core.exception.ConfigurationException;
import com.taskagent.core.exception.IterationLimitExceededException;
import com.taskagent.core.exception.NoStateException;
import com.taskagent.core.exception.OracleCallException;
import com.taskagent.core.model.Action;
import com.taskagent.core.model.Checkpoint;
import com.taskagent.core.model.Message;
import com.taskagent.core.model.StateJson;
import com.taskagent.core.model.StateSnapshot;
import com.taskagent.core.model.TaskState;
import com.taskagent.core.model.TaskStatus;
import com.taskagent.core.model.TaskSummary;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ActionOracle;
import com.taskagent.core.spi.ApprovalCallback;
import com.taskagent.core.spi.DebugCallback;
import com.taskagent.core.spi.Tool;
import com.taskagent.core.spi.ToolExecutionException;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.approval.ApprovalGate;
import com.taskagent.engine.logging.LoggingContext;
import com.taskagent.engine.metrics.AgentMetrics;
import com.taskagent.engine.ratelimit.RateLimiter;
import com.taskagent.engine.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs tasks: asks the oracle for the next action, executes approved tools,
 * and persists progress until the oracle signals completion or the iteration
 * limit is hit.
 *
 * One engine runs one task at a time on the calling thread. Every mutation of
 * the task state is persisted before the loop moves on, and the final state is
 * persisted whether the task completes or fails.
 */
public class AgentEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentEngine.class);

    private static final int RELATED_TASK_LIMIT = 5;
    private static final TypeReference<Map<String, Object>> STATE_MAP = new TypeReference<>() {};

    private final ActionOracle oracle;
    private final ToolRegistry tools;
    private final StateStorage storage;
    private final RateLimiter rateLimiter;
    private final ApprovalGate approvalGate;
    private final AgentSettings settings;
    private final AgentMetrics metrics;
    private final DebugSession debugSession;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TaskState state;

    private int checkpointCount;

    private AgentEngine(Builder builder) {
        this.oracle = builder.oracle;
        this.tools = new ToolRegistry(builder.tools);
        this.storage = builder.storage;
        this.settings = builder.settings;
        this.metrics = builder.metrics != null ? builder.metrics : new AgentMetrics();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : StateJson.newObjectMapper();
        if (builder.rateLimiter != null) {
            this.rateLimiter = builder.rateLimiter;
        } else {
            this.rateLimiter = new RateLimiter(settings.rateLimit(), builder.clock, Sleeper.SYSTEM);
            rateLimiter.setMetrics(metrics);
        }
        this.approvalGate = new ApprovalGate(
            settings.autoApproveTools(),
            settings.maxConsecutiveAutoApprovals(),
            builder.approvalCallback,
            settings.approvalTimeout()
        );
        this.clock = builder.clock;
        this.state = new TaskState(builder.clock);
        this.debugSession = new DebugSession(builder.clock);
        debugSession.setStepByStep(settings.debug().stepByStep());
        settings.debug().breakpoints().forEach((name, breakpoint) ->
            debugSession.addBreakpoint(name, breakpoint.type(), breakpoint.condition(), breakpoint.enabled()));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Task Execution ==========

    public String executeTask(String task) {
        return executeTask(task, null);
    }

    /**
     * Run a task to completion.
     *
     * @param task Natural-language task
     * @param debugCallback Notified at breakpoints; may be null
     * @return The oracle's result, or its last thoughts when it gave no result
     * @throws ConfigurationException if no oracle is configured
     * @throws IterationLimitExceededException if the oracle never signals completion
     * @throws AgentException for any other unrecoverable failure; the task is marked failed
     */
    public String executeTask(String task, DebugCallback debugCallback) {
        if (oracle == null) {
            throw new ConfigurationException("No action oracle configured");
        }
        DebugCallback callback = debugCallback != null ? debugCallback : new DebugCallback() {};

        String taskId = UUID.randomUUID().toString();
        state.startNewTask(task, taskId);
        checkpointCount = 0;

        try (LoggingContext ignored = LoggingContext.forTask(taskId)) {
            if (settings.debug().enabled()) {
                debugSession.start();
            }
            metrics.taskStarted();
            log.info("Starting task {}: {}", taskId, task);
            try {
                saveMessage(Message.ROLE_SYSTEM, "Starting task: " + task, Map.of());
                loadRelatedTasks(taskId);

                String result = runLoop(task, callback);
                metrics.taskCompleted(state.getTaskDuration().orElse(null));
                return result;
            } catch (RuntimeException e) {
                if (!state.isFailed()) {
                    state.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                }
                log.error("Task {} failed: {}", taskId, state.getErrorMessage(), e);
                metrics.taskFailed(errorType(e), state.getTaskDuration().orElse(null));
                if (debugSession.isActive()) {
                    callback.onError(e, debugInfo("error", errorDetails(e)));
                }
                throw e;
            } finally {
                try {
                    persistState();
                } finally {
                    debugSession.stop();
                    approvalGate.close();
                }
            }
        }
    }

    private String runLoop(String task, DebugCallback callback) {
        int iteration = 0;
        while (true) {
            if (iteration >= settings.maxIterations()) {
                state.markFailed("Maximum iterations reached");
                throw new IterationLimitExceededException(settings.maxIterations());
            }
            iteration++;
            LoggingContext.setIteration(iteration);

            if (debugSession.isActive()) {
                Map<String, Object> details = details("task", task, "state", stateView());
                checkBreakpoint(BreakpointType.LLM, details, callback);
            }

            Action action = nextAction(task);
            saveMessage(Message.ROLE_ASSISTANT, action.thoughts(), Map.of());

            if (action.complete()) {
                String result = action.result() != null ? action.result() : action.thoughts();
                state.markComplete();
                saveMessage(Message.ROLE_SYSTEM, "Task completed: " + result,
                    Collections.singletonMap("result", action.result()));
                log.info("Task {} completed after {} iterations", state.getTaskId(), iteration);
                return result;
            }

            if (action.hasTool()) {
                dispatchTool(action, callback);
            } else {
                log.debug("Iteration {} produced no tool call", iteration);
            }
        }
    }

    private Action nextAction(String task) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("INTERRUPTED", "Interrupted while waiting for the oracle rate limit", e);
        }
        try {
            Action action = oracle.nextAction(task, state, tools.names());
            return action != null ? action : Action.thinking("Oracle returned no action");
        } catch (OracleCallException e) {
            metrics.oracleError();
            log.warn("Oracle call failed: {}", e.getMessage());
            return Action.thinking("Error getting next action: " + e.getMessage());
        }
    }

    private void dispatchTool(Action action, DebugCallback callback) {
        String toolName = action.toolName();
        Map<String, Object> args = action.toolArgs();
        Tool tool = tools.require(toolName);

        if (debugSession.isActive()) {
            checkBreakpoint(BreakpointType.TOOL, details("tool_name", toolName, "args", args, "state", stateView()), callback);
        }

        if (!approvalGate.approve(state, toolName, args, action.thoughts())) {
            metrics.toolRejected(toolName);
            return;
        }

        ToolResult result;
        try (LoggingContext ignored = LoggingContext.forTool(toolName)) {
            result = invoke(tool, args);
            log.info("Tool {} finished: success={}", toolName, result.success());
        }
        state.addToolExecution(toolName, args, result);
        metrics.toolExecuted(toolName, result.success());
        persistState();

        if (settings.autoCheckpoint()) {
            autoCheckpoint("After executing tool: " + toolName);
        }

        if (debugSession.isActive()) {
            Map<String, Object> resultView = objectMapper.convertValue(result, STATE_MAP);
            checkBreakpoint(BreakpointType.STATE, details("tool_name", toolName, "result", resultView, "state", stateView()), callback);
        }
    }

    private ToolResult invoke(Tool tool, Map<String, Object> args) {
        try {
            ToolResult result = tool.execute(args);
            return result != null ? result : ToolResult.failure("Tool " + tool.name() + " returned no result");
        } catch (ToolExecutionException e) {
            log.warn("Tool {} failed [{}]: {}", tool.name(), e.getErrorCode(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Tool {} threw an exception", tool.name(), e);
            return ToolResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void autoCheckpoint(String description) {
        try {
            createCheckpoint(description);
        } catch (AgentException e) {
            log.warn("Failed to create checkpoint: {}", e.getMessage());
        }
    }

    private void loadRelatedTasks(String taskId) {
        try {
            List<TaskSummary> related = storage.getRelatedTasks(taskId, RELATED_TASK_LIMIT);
            if (!related.isEmpty()) {
                state.addRelatedTasks(related);
                persistState();
                log.debug("Found {} related tasks", related.size());
            }
        } catch (AgentException e) {
            log.warn("Failed to look up related tasks: {}", e.getMessage());
        }
    }

    // ========== Breakpoints ==========

    private void checkBreakpoint(BreakpointType type, Map<String, Object> details, DebugCallback callback) {
        if (!debugSession.shouldBreak(type, details)) {
            return;
        }
        log.info("Breakpoint hit at {}", type);
        DebugInfo info = debugInfo(type.name(), details);
        callback.onBreak(info);
        if (debugSession.isStepByStep()) {
            callback.onStep(info);
        }
    }

    private DebugInfo debugInfo(String action, Map<String, Object> details) {
        return new DebugInfo(clock.instant(), action, details, stateView());
    }

    private Map<String, Object> stateView() {
        return objectMapper.convertValue(state.snapshot(), STATE_MAP);
    }

    private static Map<String, Object> errorDetails(RuntimeException e) {
        return details("error", e.getMessage(), "error_type", e.getClass().getSimpleName());
    }

    private static Map<String, Object> details(Object... keysAndValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            details.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return details;
    }

    private static String errorType(RuntimeException e) {
        return e instanceof AgentException agentException ? agentException.getErrorCode() : e.getClass().getSimpleName();
    }

    // ========== State Helpers ==========

    private void persistState() {
        if (state.getTaskId() != null) {
            storage.saveState(state.getTaskId(), state.snapshot());
        }
    }

    /**
     * Record input from the user for the current task.
     */
    public void saveUserInput(String content, Map<String, Object> metadata) {
        state.addUserInput(content, metadata);
        persistState();
    }

    public void saveMessage(String role, String content, Map<String, Object> metadata) {
        state.addMessage(role, content, metadata);
        persistState();
    }

    /**
     * Merge values into the context. The context outlives the current task.
     */
    public void updateContext(Map<String, Object> updates) {
        state.updateContext(updates);
        persistState();
    }

    /**
     * Tasks whose context overlaps the current task's context.
     */
    public List<TaskSummary> getRelatedTasks(int limit) {
        if (state.getTaskId() == null) {
            return List.of();
        }
        return storage.getRelatedTasks(state.getTaskId(), limit);
    }

    /**
     * Past tasks whose messages mention the query, most mentions first.
     */
    public List<TaskSummary> searchTaskHistory(String query, int limit) {
        List<TaskSummary> results = new ArrayList<>();
        storage.searchTaskHistory(query, limit).forEach(match -> {
            Optional<StateSnapshot> snapshot = storage.loadState(match.taskId());
            results.add(new TaskSummary(
                match.taskId(),
                snapshot.map(StateSnapshot::task).orElse(null),
                match.relevance(),
                snapshot.map(StateSnapshot::complete).orElse(false)
            ));
        });
        return results;
    }

    /**
     * Checkpoint the current task.
     *
     * @return The checkpoint, or empty once the per-task checkpoint limit is reached
     * @throws com.taskagent.core.exception.NoStateException if no task has been started
     */
    public Optional<Checkpoint> createCheckpoint(String description) {
        if (checkpointCount >= settings.maxCheckpoints()) {
            log.debug("Checkpoint limit of {} reached, skipping '{}'", settings.maxCheckpoints(), description);
            return Optional.empty();
        }
        String taskId = state.getTaskId();
        if (taskId == null) {
            throw new NoStateException("(none)");
        }
        Checkpoint checkpoint = storage.createCheckpoint(taskId, description);
        checkpointCount++;
        metrics.checkpointCreated();
        log.info("Created checkpoint {}: {}", checkpoint.id(), description);
        return Optional.of(checkpoint);
    }

    public List<Checkpoint> listCheckpoints() {
        if (state.getTaskId() == null) {
            return List.of();
        }
        return storage.listCheckpoints(state.getTaskId());
    }

    /**
     * Restore a checkpoint into storage and into this engine's state.
     */
    public StateSnapshot restoreCheckpoint(String checkpointId) {
        StateSnapshot snapshot = storage.restoreCheckpoint(checkpointId);
        state.restore(snapshot);
        log.info("Restored state of task {} from checkpoint {}", snapshot.taskId(), checkpointId);
        return snapshot;
    }

    public void registerTool(Tool tool) {
        tools.register(tool);
    }

    public List<String> getToolNames() {
        return tools.names();
    }

    public TaskState getState() {
        return state;
    }

    public String getTaskId() {
        return state.getTaskId();
    }

    public TaskStatus getStatus() {
        return state.getStatus();
    }

    /**
     * The session consulted at breakpoints; breakpoints may be changed while a task runs.
     */
    public DebugSession getDebugSession() {
        return debugSession;
    }

    public AgentSettings getSettings() {
        return settings;
    }

    /**
     * Builder for AgentEngine.
     */
    public static class Builder {
        private ActionOracle oracle;
        private final List<Tool> tools = new ArrayList<>();
        private StateStorage storage;
        private RateLimiter rateLimiter;
        private ApprovalCallback approvalCallback;
        private AgentSettings settings = AgentSettings.defaults();
        private AgentMetrics metrics;
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        public Builder oracle(ActionOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        public Builder tool(Tool tool) {
            this.tools.add(tool);
            return this;
        }

        public Builder tools(Collection<? extends Tool> tools) {
            this.tools.addAll(tools);
            return this;
        }

        public Builder storage(StateStorage storage) {
            this.storage = storage;
            return this;
        }

        /**
         * Share a limiter between engines; by default each engine gets its own.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder approvalCallback(ApprovalCallback approvalCallback) {
            this.approvalCallback = approvalCallback;
            return this;
        }

        public Builder settings(AgentSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder metrics(AgentMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws ConfigurationException if no storage is set
         */
        public AgentEngine build() {
            if (storage == null) {
                throw new ConfigurationException("State storage is required");
            }
            return new AgentEngine(this);
        }
    }
}
