package com.taskagent.core.model;

/**
 * Search hit: a task id and the number of its messages matching the query.
 */
public record TaskRelevance(String taskId, int relevance) {
}
