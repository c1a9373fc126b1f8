package com.taskagent.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable progress record of the task currently run by one engine.
 *
 * Invariants:
 * - failed implies complete
 * - messages and tool executions are append-only within a task
 * - context and related tasks survive {@link #startNewTask}
 *
 * Not thread-safe; owned by a single engine.
 */
public class TaskState {

    private final Clock clock;

    private String task;
    private String taskId;
    private final List<Message> messages = new ArrayList<>();
    private final List<ToolExecution> toolExecutions = new ArrayList<>();
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final List<TaskSummary> relatedTasks = new ArrayList<>();
    private final List<Message> userInputs = new ArrayList<>();
    private Instant startTime;
    private Instant endTime;
    private boolean complete;
    private boolean failed;
    private String errorMessage;
    private int consecutiveAutoApprovals;

    public TaskState() {
        this(Clock.systemUTC());
    }

    public TaskState(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reset per-task progress for a new task. Context and related tasks are kept
     * so later tasks can build on what earlier ones learned.
     */
    public void startNewTask(String newTask, String newTaskId) {
        this.task = newTask;
        this.taskId = newTaskId;
        messages.clear();
        toolExecutions.clear();
        userInputs.clear();
        startTime = clock.instant();
        endTime = null;
        complete = false;
        failed = false;
        errorMessage = null;
        consecutiveAutoApprovals = 0;
    }

    public Message addMessage(String role, String content, Map<String, Object> metadata) {
        Message message = new Message(role, content, metadata, clock.instant());
        messages.add(message);
        return message;
    }

    public Message addUserInput(String content, Map<String, Object> metadata) {
        Message input = new Message(Message.ROLE_USER, content, metadata, clock.instant());
        userInputs.add(input);
        return input;
    }

    public ToolExecution addToolExecution(String toolName, Map<String, Object> args, ToolResult result) {
        ToolExecution execution = new ToolExecution(toolName, args, result, clock.instant());
        toolExecutions.add(execution);
        return execution;
    }

    public void updateContext(Map<String, Object> updates) {
        context.putAll(updates);
    }

    public void addRelatedTasks(List<TaskSummary> tasks) {
        relatedTasks.addAll(tasks);
    }

    public void markComplete() {
        complete = true;
        endTime = clock.instant();
    }

    public void markFailed(String error) {
        failed = true;
        complete = true;
        errorMessage = error;
        endTime = clock.instant();
    }

    public void resetAutoApprovals() {
        consecutiveAutoApprovals = 0;
    }

    public void incrementAutoApprovals() {
        consecutiveAutoApprovals++;
    }

    public Optional<ToolExecution> getLastToolExecution() {
        return toolExecutions.isEmpty()
            ? Optional.empty()
            : Optional.of(toolExecutions.get(toolExecutions.size() - 1));
    }

    /**
     * Elapsed time of the task; measured up to now while it is still running.
     */
    public Optional<Duration> getTaskDuration() {
        if (startTime == null) {
            return Optional.empty();
        }
        Instant end = endTime != null ? endTime : clock.instant();
        return Optional.of(Duration.between(startTime, end));
    }

    public TaskStatus getStatus() {
        if (taskId == null) {
            return TaskStatus.INIT;
        }
        if (failed) {
            return TaskStatus.FAILED;
        }
        return complete ? TaskStatus.COMPLETE : TaskStatus.RUNNING;
    }

    public StateSnapshot snapshot() {
        return new StateSnapshot(
            task, taskId, messages, toolExecutions, context, relatedTasks, userInputs,
            complete, failed, errorMessage, startTime, endTime, consecutiveAutoApprovals
        );
    }

    /**
     * Replace the whole state with a previously persisted snapshot.
     */
    public void restore(StateSnapshot snapshot) {
        task = snapshot.task();
        taskId = snapshot.taskId();
        messages.clear();
        messages.addAll(snapshot.messages());
        toolExecutions.clear();
        toolExecutions.addAll(snapshot.toolExecutions());
        context.clear();
        context.putAll(snapshot.context());
        relatedTasks.clear();
        relatedTasks.addAll(snapshot.relatedTasks());
        userInputs.clear();
        userInputs.addAll(snapshot.userInputs());
        complete = snapshot.complete();
        failed = snapshot.failed();
        errorMessage = snapshot.errorMessage();
        startTime = snapshot.startTime();
        endTime = snapshot.endTime();
        consecutiveAutoApprovals = snapshot.consecutiveAutoApprovals();
    }

    public String getTask() {
        return task;
    }

    public String getTaskId() {
        return taskId;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ToolExecution> getToolExecutions() {
        return Collections.unmodifiableList(toolExecutions);
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<TaskSummary> getRelatedTasks() {
        return Collections.unmodifiableList(relatedTasks);
    }

    public List<Message> getUserInputs() {
        return Collections.unmodifiableList(userInputs);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isFailed() {
        return failed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getConsecutiveAutoApprovals() {
        return consecutiveAutoApprovals;
    }
}
