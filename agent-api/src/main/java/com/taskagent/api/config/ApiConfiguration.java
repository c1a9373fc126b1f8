package com.taskagent.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.api.approval.AllowListApprovalCallback;
import com.taskagent.api.oracle.HttpActionOracle;
import com.taskagent.core.spi.ActionOracle;
import com.taskagent.core.spi.ApprovalCallback;
import com.taskagent.engine.config.AgentProperties;
import com.taskagent.tools.ListFilesTool;
import com.taskagent.tools.ReadFileTool;
import com.taskagent.tools.ReplaceInFileTool;
import com.taskagent.tools.RunCommandTool;
import com.taskagent.tools.SearchFilesTool;
import com.taskagent.tools.WriteFileTool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Collaborators of the engine when it runs as a service: the built-in tools,
 * an HTTP oracle and an allow-list approval policy.
 */
@Configuration
public class ApiConfiguration {

    @Bean
    public ReadFileTool readFileTool(AgentProperties properties) {
        return new ReadFileTool(workingDirectory(properties));
    }

    @Bean
    public WriteFileTool writeFileTool(AgentProperties properties) {
        return new WriteFileTool(workingDirectory(properties));
    }

    @Bean
    public ListFilesTool listFilesTool(AgentProperties properties) {
        return new ListFilesTool(workingDirectory(properties));
    }

    @Bean
    public SearchFilesTool searchFilesTool(AgentProperties properties) {
        return new SearchFilesTool(workingDirectory(properties));
    }

    @Bean
    public ReplaceInFileTool replaceInFileTool(AgentProperties properties) {
        return new ReplaceInFileTool(workingDirectory(properties));
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.tools", name = "run-command-enabled", havingValue = "true", matchIfMissing = true)
    public RunCommandTool runCommandTool(AgentProperties properties) {
        return new RunCommandTool(workingDirectory(properties));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agent.oracle", name = "url")
    public ActionOracle httpActionOracle(AgentProperties properties, ObjectMapper objectMapper) {
        return new HttpActionOracle(
            properties.getOracle().getUrl(),
            properties.getOracle().getTimeout(),
            objectMapper
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalCallback allowListApprovalCallback(AgentProperties properties) {
        return new AllowListApprovalCallback(properties.getApproval().getAllowedTools());
    }

    private static Path workingDirectory(AgentProperties properties) {
        return Path.of(properties.getWorkingDirectory()).toAbsolutePath().normalize();
    }
}
