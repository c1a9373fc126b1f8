package com.taskagent.api.rest;

import com.taskagent.core.model.TaskSummary;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.AgentEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over past tasks: message search and context-based relatedness.
 */
@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private final ObjectProvider<AgentEngine> engines;
    private final StateStorage storage;

    public HistoryController(ObjectProvider<AgentEngine> engines, StateStorage storage) {
        this.engines = engines;
        this.storage = storage;
    }

    /**
     * Tasks whose messages mention the query, most mentions first.
     */
    @GetMapping("/search")
    public ResponseEntity<List<TaskSummary>> search(
            @RequestParam String query,
            @RequestParam(defaultValue = "5") int limit) {

        if (query.isBlank() || limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(engines.getObject().searchTaskHistory(query, limit));
    }

    /**
     * Tasks sharing context values with the given task.
     */
    @GetMapping("/{taskId}/related")
    public ResponseEntity<List<TaskSummary>> related(
            @PathVariable String taskId,
            @RequestParam(defaultValue = "5") int limit) {

        if (limit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(storage.getRelatedTasks(taskId, limit));
    }
}
