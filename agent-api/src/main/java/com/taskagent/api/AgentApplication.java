package com.taskagent.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the task agent.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.taskagent.api",
    "com.taskagent.engine.config"
})
public class AgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
    }
}
