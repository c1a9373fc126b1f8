package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Comparator;

/**
 * Immutable snapshot of a task's state at a point in time.
 *
 * Primary Key: id ({@code taskId_sequence}, sequence starting at 1)
 *
 * Invariants:
 * - checkpoints of one task form a singly linked chain through parentId
 * - the first checkpoint of a task has no parent
 * - never modified after creation
 */
public record Checkpoint(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("description") String description,
    @JsonProperty("state") StateSnapshot state,
    @JsonProperty("parent_id") String parentId
) {
    /**
     * Oldest first; the sequence number breaks timestamp ties.
     */
    public static final Comparator<Checkpoint> CHRONOLOGICAL =
        Comparator.comparing(Checkpoint::timestamp).thenComparingInt(Checkpoint::sequenceNumber);

    /**
     * Build the identifier of the n-th checkpoint of a task.
     */
    public static String idFor(String taskId, int sequenceNumber) {
        return taskId + "_" + sequenceNumber;
    }

    /**
     * Sequence number encoded in the identifier.
     */
    @JsonIgnore
    public int sequenceNumber() {
        return Integer.parseInt(id.substring(id.lastIndexOf('_') + 1));
    }
}
