package com.taskagent.api.rest;

import com.taskagent.core.exception.AgentException;
import com.taskagent.core.exception.ConfigurationException;
import com.taskagent.core.exception.NoStateException;
import com.taskagent.core.model.Checkpoint;
import com.taskagent.core.model.StateSnapshot;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.AgentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for running tasks and managing their checkpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final ObjectProvider<AgentEngine> engines;
    private final StateStorage storage;

    public TaskController(ObjectProvider<AgentEngine> engines, StateStorage storage) {
        this.engines = engines;
        this.storage = storage;
    }

    /**
     * Run a task to completion on a fresh engine. Blocks until the task ends.
     */
    @PostMapping("/tasks")
    public ResponseEntity<TaskRunResponse> runTask(@RequestBody RunTaskRequest request) {
        if (request == null || request.task() == null || request.task().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        AgentEngine engine = engines.getObject();
        String result = null;
        try {
            result = engine.executeTask(request.task());
        } catch (ConfigurationException e) {
            throw e;
        } catch (AgentException e) {
            log.warn("Task {} ended with {}: {}", engine.getTaskId(), e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.ok(TaskRunResponse.from(engine, result));
    }

    /**
     * Get the persisted state document of a task.
     */
    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<StateSnapshot> getTask(@PathVariable String taskId) {
        StateSnapshot snapshot = storage.loadState(taskId)
            .orElseThrow(() -> new NoStateException(taskId));
        return ResponseEntity.ok(snapshot);
    }

    /**
     * List a task's checkpoints, oldest first.
     */
    @GetMapping("/tasks/{taskId}/checkpoints")
    public ResponseEntity<List<CheckpointResponse>> listCheckpoints(@PathVariable String taskId) {
        List<CheckpointResponse> responses = storage.listCheckpoints(taskId).stream()
            .map(CheckpointResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Overwrite a task's current state with a checkpoint.
     */
    @PostMapping("/checkpoints/{checkpointId}/restore")
    public ResponseEntity<StateSnapshot> restoreCheckpoint(@PathVariable String checkpointId) {
        StateSnapshot restored = storage.restoreCheckpoint(checkpointId);
        log.info("Restored task {} from checkpoint {}", restored.taskId(), checkpointId);
        return ResponseEntity.ok(restored);
    }

    // ========== DTOs ==========

    public record RunTaskRequest(String task) {}

    public record TaskRunResponse(
        String taskId,
        String result,
        boolean complete,
        boolean failed,
        String errorMessage
    ) {
        static TaskRunResponse from(AgentEngine engine, String result) {
            return new TaskRunResponse(
                engine.getTaskId(),
                result,
                engine.getState().isComplete(),
                engine.getState().isFailed(),
                engine.getState().getErrorMessage()
            );
        }
    }

    /**
     * Checkpoint metadata without the state document.
     */
    public record CheckpointResponse(
        String id,
        String taskId,
        String description,
        String parentId,
        Instant timestamp
    ) {
        static CheckpointResponse from(Checkpoint checkpoint) {
            return new CheckpointResponse(
                checkpoint.id(),
                checkpoint.taskId(),
                checkpoint.description(),
                checkpoint.parentId(),
                checkpoint.timestamp()
            );
        }
    }
}
