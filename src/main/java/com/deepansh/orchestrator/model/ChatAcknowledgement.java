package com.deepansh.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immediate reply of the async chat endpoint. The real answer arrives on the webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatAcknowledgement {

    private String sessionId;
    private String message;
    private String messageType;
    private Instant timestamp;

    @JsonProperty("isComplete")
    private boolean complete;

    public static ChatAcknowledgement status(String sessionId, String message) {
        return new ChatAcknowledgement(sessionId, message, "status", Instant.now(), false);
    }

    public static ChatAcknowledgement error(String sessionId, String message) {
        return new ChatAcknowledgement(sessionId, message, "error", Instant.now(), true);
    }
}
