package com.taskagent.api.rest;

import com.taskagent.core.model.Action;
import com.taskagent.core.model.StateJson;
import com.taskagent.core.model.TaskState;
import com.taskagent.core.model.ToolResult;
import com.taskagent.core.spi.ActionOracle;
import com.taskagent.core.spi.Tool;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.AgentEngine;
import com.taskagent.engine.AgentSettings;
import com.taskagent.engine.persistence.file.FileStateStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TaskControllerTest {

    @TempDir
    Path stateDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);
    private StateStorage storage;

    @BeforeEach
    void setUp() {
        storage = new FileStateStorage(stateDir, StateJson.newObjectMapper(), clock);
    }

    private AgentEngine.Builder engine(Action... script) {
        return AgentEngine.builder()
            .oracle(new ScriptedOracle(script))
            .storage(storage)
            .clock(clock)
            .tool(new NoopTool())
            .settings(AgentSettings.builder().rateLimit(1000).autoApproveTools(true).build());
    }

    private MockMvc mockMvc(AgentEngine engine) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory(Map.of("agentEngine", engine));
        TaskController controller = new TaskController(beans.getBeanProvider(AgentEngine.class), storage);
        return MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(StateJson.newObjectMapper()))
            .build();
    }

    private static String taskBody(String task) {
        return "{\"task\": \"" + task + "\"}";
    }

    @Test
    @DisplayName("A task that completes returns its result")
    void runTask_completed_shouldReturnResult() throws Exception {
        AgentEngine engine = engine(Action.complete("42", "done")).build();

        mockMvc(engine).perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(taskBody("answer")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.taskId", notNullValue()))
            .andExpect(jsonPath("$.result", is("42")))
            .andExpect(jsonPath("$.complete", is(true)))
            .andExpect(jsonPath("$.failed", is(false)));
    }

    @Test
    @DisplayName("A task that runs out of iterations is reported as failed")
    void runTask_iterationLimit_shouldReportFailure() throws Exception {
        AgentEngine engine = engine()
            .settings(AgentSettings.builder().rateLimit(1000).maxIterations(2).build())
            .build();

        mockMvc(engine).perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(taskBody("endless")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.complete", is(true)))
            .andExpect(jsonPath("$.failed", is(true)))
            .andExpect(jsonPath("$.errorMessage", is("Maximum iterations reached")))
            .andExpect(jsonPath("$.result", nullValue()));
    }

    @Test
    void runTask_withoutOracle_shouldBeUnavailable() throws Exception {
        AgentEngine engine = AgentEngine.builder().storage(storage).clock(clock).build();

        mockMvc(engine).perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(taskBody("anything")))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode", is("CONFIGURATION_ERROR")));
    }

    @Test
    void runTask_blankTask_shouldBeRejected() throws Exception {
        mockMvc(engine().build()).perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(taskBody(" ")))
            .andExpect(status().isBadRequest());
    }

    @Test
    void getTask_shouldReturnPersistedState() throws Exception {
        AgentEngine engine = engine(Action.complete("ok", "done")).build();
        engine.executeTask("persist me");

        mockMvc(engine).perform(get("/api/v1/tasks/{taskId}", engine.getTaskId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.task_id", is(engine.getTaskId())))
            .andExpect(jsonPath("$.task", is("persist me")))
            .andExpect(jsonPath("$.is_complete", is(true)))
            .andExpect(jsonPath("$.messages", hasSize(3)));
    }

    @Test
    void getTask_unknown_shouldBeNotFound() throws Exception {
        mockMvc(engine().build()).perform(get("/api/v1/tasks/{taskId}", "missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode", is("NO_STATE")));
    }

    @Test
    @DisplayName("Checkpoints taken after tool calls can be listed and restored")
    void checkpoints_shouldListAndRestore() throws Exception {
        AgentEngine engine = engine(
            Action.useTool("noop", Map.of(), "first"),
            Action.useTool("noop", Map.of(), "second"),
            Action.complete("done", "finished")
        ).build();
        engine.executeTask("two steps");
        String taskId = engine.getTaskId();
        MockMvc mvc = mockMvc(engine);

        mvc.perform(get("/api/v1/tasks/{taskId}/checkpoints", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].id", is(taskId + "_1")))
            .andExpect(jsonPath("$[0].parentId", nullValue()))
            .andExpect(jsonPath("$[1].parentId", is(taskId + "_1")))
            .andExpect(jsonPath("$[1].description", is("After executing tool: noop")));

        mvc.perform(post("/api/v1/checkpoints/{checkpointId}/restore", taskId + "_1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tool_executions", hasSize(1)))
            .andExpect(jsonPath("$.is_complete", is(false)));

        mvc.perform(get("/api/v1/tasks/{taskId}", taskId))
            .andExpect(jsonPath("$.tool_executions", hasSize(1)));
    }

    @Test
    void restore_unknownCheckpoint_shouldBeNotFound() throws Exception {
        mockMvc(engine().build()).perform(post("/api/v1/checkpoints/{checkpointId}/restore", "nope_1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode", is("CHECKPOINT_NOT_FOUND")));
    }

    private static class ScriptedOracle implements ActionOracle {
        private final Deque<Action> script;

        ScriptedOracle(Action... actions) {
            this.script = new ArrayDeque<>(List.of(actions));
        }

        @Override
        public Action nextAction(String task, TaskState state, List<String> availableTools) {
            Action next = script.poll();
            return next != null ? next : Action.thinking("still thinking");
        }
    }

    private static class NoopTool implements Tool {
        @Override
        public String name() {
            return "noop";
        }

        @Override
        public String description() {
            return "Does nothing";
        }

        @Override
        public ToolResult execute(Map<String, Object> args) {
            return ToolResult.ok("nothing done");
        }
    }
}
