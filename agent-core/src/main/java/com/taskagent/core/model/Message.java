package com.taskagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * One conversation entry of a task (system, assistant or user).
 */
public record Message(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";

    public Message {
        content = content != null ? content : "";
        metadata = Collections2.copyOf(metadata);
    }
}
