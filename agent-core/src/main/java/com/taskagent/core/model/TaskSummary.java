package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A previously persisted task, as returned by history search and related-task lookup.
 */
public record TaskSummary(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task") String task,
    @JsonProperty("relevance") double relevance,
    @JsonProperty("completed") boolean completed
) {
}
