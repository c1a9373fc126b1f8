package com.taskagent.api.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskagent.core.exception.AgentException;
import com.taskagent.core.exception.OracleCallException;
import com.taskagent.core.model.Action;
import com.taskagent.core.model.TaskState;
import com.taskagent.core.spi.ActionOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle that delegates to an HTTP endpoint.
 *
 * Request body:
 * <pre>
 * {"task": "...", "state": {state document}, "available_tools": ["read_file", ...]}
 * </pre>
 * The response body is an action document:
 * <pre>
 * {"tool_name": "...", "tool_args": {...}, "is_complete": false, "result": null, "thoughts": "..."}
 * </pre>
 * Transport and parse failures raise {@link OracleCallException}, which the
 * engine retries; an interrupt ends the task instead.
 */
public class HttpActionOracle implements ActionOracle {

    private static final Logger log = LoggerFactory.getLogger(HttpActionOracle.class);

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpActionOracle(String url, Duration timeout, ObjectMapper objectMapper) {
        this.endpoint = URI.create(url);
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public Action nextAction(String task, TaskState state, List<String> availableTools) {
        String body;
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("task", task);
            payload.put("state", state.snapshot());
            payload.put("available_tools", availableTools);
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new OracleCallException("Failed to encode oracle request: " + e.getOriginalMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleCallException("Oracle request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("INTERRUPTED", "Interrupted while waiting for the oracle", e);
        }

        if (response.statusCode() != 200) {
            log.warn("Oracle returned status {}", response.statusCode());
            throw new OracleCallException("Oracle returned status " + response.statusCode());
        }

        try {
            Action action = objectMapper.readValue(response.body(), Action.class);
            log.debug("Oracle proposed tool={} complete={}", action.toolName(), action.complete());
            return action;
        } catch (JsonProcessingException e) {
            throw new OracleCallException("Could not parse oracle response: " + e.getOriginalMessage(), e);
        }
    }
}
