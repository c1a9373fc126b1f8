package com.taskagent.api.config;

import com.taskagent.api.approval.AllowListApprovalCallback;
import com.taskagent.api.oracle.HttpActionOracle;
import com.taskagent.core.spi.ActionOracle;
import com.taskagent.core.spi.ApprovalCallback;
import com.taskagent.engine.AgentEngine;
import com.taskagent.engine.config.AgentEngineConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ApiConfigurationTest {

    @TempDir
    Path stateDir;

    @TempDir
    Path workspace;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
            .withUserConfiguration(AgentEngineConfiguration.class, ApiConfiguration.class)
            .withPropertyValues(
                "agent.state-storage.path=" + stateDir,
                "agent.working-directory=" + workspace);
    }

    @Test
    void engine_shouldReceiveBuiltInTools() {
        runner().run(context -> assertThat(context.getBean(AgentEngine.class).getToolNames())
            .containsExactly("list_files", "read_file", "replace_in_file", "run_command", "search_files", "write_file"));
    }

    @Test
    void runCommandDisabled_shouldLeaveItOut() {
        runner()
            .withPropertyValues("agent.tools.run-command-enabled=false")
            .run(context -> assertThat(context.getBean(AgentEngine.class).getToolNames())
                .doesNotContain("run_command")
                .hasSize(5));
    }

    @Test
    void oracleUrl_shouldCreateHttpOracle() {
        runner()
            .withPropertyValues("agent.oracle.url=http://127.0.0.1:9/next-action")
            .run(context -> assertThat(context.getBean(ActionOracle.class)).isInstanceOf(HttpActionOracle.class));
    }

    @Test
    void withoutOracleUrl_shouldHaveNoOracle() {
        runner().run(context -> assertThat(context).doesNotHaveBean(ActionOracle.class));
    }

    @Test
    void allowedTools_shouldFeedApprovalCallback() {
        runner()
            .withPropertyValues("agent.approval.allowed-tools=read_file,list_files")
            .run(context -> {
                ApprovalCallback callback = context.getBean(ApprovalCallback.class);
                assertThat(callback).isInstanceOf(AllowListApprovalCallback.class);
                assertThat(((AllowListApprovalCallback) callback).getAllowedTools())
                    .containsExactlyInAnyOrder("read_file", "list_files");
            });
    }
}
