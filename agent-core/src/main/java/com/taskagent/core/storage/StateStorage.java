package com.taskagent.core.storage;

import com.taskagent.core.model.Checkpoint;
import com.taskagent.core.model.StateSnapshot;
import com.taskagent.core.model.TaskRelevance;
import com.taskagent.core.model.TaskSummary;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of task state and its checkpoint chain.
 *
 * Implementations must return equivalent results for identical call sequences.
 * Any non-null string is a valid task id.
 * A single writer per task id is assumed; concurrent writers to the same task
 * are not supported.
 */
public interface StateStorage {

    /**
     * Save the current state of a task. Last write wins.
     *
     * @param taskId The task ID
     * @param snapshot The state document
     */
    void saveState(String taskId, StateSnapshot snapshot);

    /**
     * Load the current state of a task.
     *
     * @param taskId The task ID
     * @return The state document if one was saved
     */
    Optional<StateSnapshot> loadState(String taskId);

    /**
     * Snapshot the current state of a task as a new checkpoint linked to the
     * latest existing one.
     *
     * @param taskId The task ID
     * @param description What happened just before the checkpoint
     * @return The created checkpoint
     * @throws com.taskagent.core.exception.NoStateException if no state was saved for the task
     */
    Checkpoint createCheckpoint(String taskId, String description);

    /**
     * Overwrite a task's current state with a checkpoint's snapshot.
     *
     * @param checkpointId The checkpoint ID
     * @return The restored state document
     * @throws com.taskagent.core.exception.CheckpointNotFoundException if the id is unknown
     */
    StateSnapshot restoreCheckpoint(String checkpointId);

    /**
     * List the checkpoints of a task, oldest first.
     *
     * @param taskId The task ID
     * @return Checkpoints ordered by timestamp
     */
    List<Checkpoint> listCheckpoints(String taskId);

    /**
     * Rank tasks by how many of their messages mention the query (case-insensitive).
     *
     * @param query Text to look for
     * @param limit Maximum number of results; below 1 nothing is returned
     * @return Matching tasks, most relevant first
     */
    List<TaskRelevance> searchTaskHistory(String query, int limit);

    /**
     * Find tasks whose context overlaps with the given task's context.
     *
     * @param taskId The task ID
     * @param limit Maximum number of results; below 1 nothing is returned
     * @return Related tasks, most relevant first; tasks without overlap are excluded
     */
    List<TaskSummary> getRelatedTasks(String taskId, int limit);
}
