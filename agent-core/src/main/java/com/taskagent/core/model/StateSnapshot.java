package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted state document of a task. Backend-agnostic; both storage
 * backends read and write exactly this shape.
 */
public record StateSnapshot(
    @JsonProperty("task") String task,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("messages") List<Message> messages,
    @JsonProperty("tool_executions") List<ToolExecution> toolExecutions,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("related_tasks") List<TaskSummary> relatedTasks,
    @JsonProperty("user_inputs") List<Message> userInputs,
    @JsonProperty("is_complete") boolean complete,
    @JsonProperty("is_failed") boolean failed,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("start_time") Instant startTime,
    @JsonProperty("end_time") Instant endTime,
    @JsonProperty("consecutive_auto_approvals") int consecutiveAutoApprovals
) {
    public StateSnapshot {
        messages = Collections2.copyOf(messages);
        toolExecutions = Collections2.copyOf(toolExecutions);
        context = Collections2.copyOf(context);
        relatedTasks = Collections2.copyOf(relatedTasks);
        userInputs = Collections2.copyOf(userInputs);
    }

    /**
     * Copy of this snapshot with messages and context replaced, used by backends
     * that keep those sections in separate documents or tables.
     */
    public StateSnapshot withMessagesAndContext(List<Message> newMessages, Map<String, Object> newContext) {
        return new StateSnapshot(
            task, taskId, newMessages, toolExecutions, newContext, relatedTasks, userInputs,
            complete, failed, errorMessage, startTime, endTime, consecutiveAutoApprovals
        );
    }
}
