package com.taskagent.engine.config;

import com.taskagent.core.debug.BreakpointType;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.AgentEngine;
import com.taskagent.engine.AgentSettings;
import com.taskagent.engine.persistence.file.FileStateStorage;
import com.taskagent.engine.persistence.jdbc.JdbcStateStorage;
import com.taskagent.engine.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class AgentEngineConfigurationTest {

    @TempDir
    Path stateDir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
            .withUserConfiguration(AgentEngineConfiguration.class)
            .withPropertyValues("agent.state-storage.path=" + stateDir);
    }

    @Test
    void defaults_shouldUseFileStorage() {
        runner().run(context -> {
            assertThat(context).hasSingleBean(StateStorage.class);
            assertThat(context.getBean(StateStorage.class)).isInstanceOf(FileStateStorage.class);
            assertThat(context.getBean(RateLimiter.class).getRequestsPerMinute()).isEqualTo(60);
        });
    }

    @Test
    void jdbcType_shouldUseJdbcStorage() {
        runner()
            .withPropertyValues("agent.state-storage.type=jdbc")
            .withBean(DataSource.class, () -> new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build())
            .run(context -> assertThat(context.getBean(StateStorage.class)).isInstanceOf(JdbcStateStorage.class));
    }

    @Test
    void properties_shouldMapToEngineSettings() {
        runner()
            .withPropertyValues(
                "agent.auto-approve-tools=true",
                "agent.max-consecutive-auto-approvals=5",
                "agent.max-iterations=12",
                "agent.rate-limit=30",
                "agent.approval-timeout=2m",
                "agent.state-storage.auto-checkpoint=false",
                "agent.state-storage.max-checkpoints=4",
                "agent.debug.enabled=true",
                "agent.debug.breakpoints.writes.type=TOOL",
                "agent.debug.breakpoints.writes.condition=tool_name == 'write_file'"
            )
            .run(context -> {
                AgentSettings settings = context.getBean(AgentProperties.class).toSettings();
                assertThat(settings.autoApproveTools()).isTrue();
                assertThat(settings.maxConsecutiveAutoApprovals()).isEqualTo(5);
                assertThat(settings.maxIterations()).isEqualTo(12);
                assertThat(settings.rateLimit()).isEqualTo(30);
                assertThat(settings.approvalTimeout()).isEqualTo(Duration.ofMinutes(2));
                assertThat(settings.autoCheckpoint()).isFalse();
                assertThat(settings.maxCheckpoints()).isEqualTo(4);
                assertThat(settings.debug().enabled()).isTrue();
                assertThat(settings.debug().breakpoints().get("writes"))
                    .isEqualTo(new AgentSettings.BreakpointSettings(BreakpointType.TOOL, "tool_name == 'write_file'", true));
            });
    }

    @Test
    void agentEngine_shouldBeCreatedPerRequest() {
        runner().run(context -> {
            AgentEngine first = context.getBean(AgentEngine.class);
            AgentEngine second = context.getBean(AgentEngine.class);

            assertThat(first).isNotSameAs(second);
            assertThat(first.getToolNames()).isEmpty();
        });
    }
}
