package com.taskagent.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.core.model.StateJson;
import com.taskagent.core.spi.ActionOracle;
import com.taskagent.core.spi.ApprovalCallback;
import com.taskagent.core.spi.Tool;
import com.taskagent.core.storage.StateStorage;
import com.taskagent.engine.AgentEngine;
import com.taskagent.engine.metrics.AgentMetrics;
import com.taskagent.engine.persistence.file.FileStateStorage;
import com.taskagent.engine.persistence.jdbc.JdbcStateStorage;
import com.taskagent.engine.ratelimit.RateLimiter;
import com.taskagent.engine.ratelimit.Sleeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Engine wiring. The storage backend is chosen by {@code agent.state-storage.type}.
 *
 * Engines are prototypes: each task run gets its own engine and task state,
 * while storage, the rate limiter and metrics are shared.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock agentClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return StateJson.newObjectMapper();
    }

    @Bean
    public AgentMetrics agentMetrics() {
        return new AgentMetrics();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.state-storage", name = "type", havingValue = "file", matchIfMissing = true)
    public StateStorage fileStateStorage(AgentProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new FileStateStorage(Path.of(properties.getStateStorage().getPath()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.state-storage", name = "type", havingValue = "jdbc")
    public StateStorage jdbcStateStorage(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        return JdbcStateStorage.create(dataSource, objectMapper, clock);
    }

    /**
     * One limiter for all engines, so they share the oracle quota.
     */
    @Bean
    public RateLimiter rateLimiter(AgentProperties properties, Clock clock, AgentMetrics metrics) {
        RateLimiter rateLimiter = new RateLimiter(properties.getRateLimit(), clock, Sleeper.SYSTEM);
        rateLimiter.setMetrics(metrics);
        return rateLimiter;
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public AgentEngine agentEngine(AgentProperties properties,
                                   StateStorage storage,
                                   RateLimiter rateLimiter,
                                   AgentMetrics metrics,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   ObjectProvider<ActionOracle> oracle,
                                   ObjectProvider<ApprovalCallback> approvalCallback,
                                   ObjectProvider<Tool> tools) {
        return AgentEngine.builder()
            .settings(properties.toSettings())
            .storage(storage)
            .rateLimiter(rateLimiter)
            .metrics(metrics)
            .objectMapper(objectMapper)
            .clock(clock)
            .oracle(oracle.getIfAvailable())
            .approvalCallback(approvalCallback.getIfAvailable())
            .tools(tools.orderedStream().toList())
            .build();
    }
}
