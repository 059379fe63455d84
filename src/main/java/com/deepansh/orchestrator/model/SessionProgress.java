package com.deepansh.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of one webhook POST. Created per notification, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionProgress {

    private String sessionId;
    private String partialMessage;
    private ProgressStatus status;

    // Explicit name: Lombok would otherwise expose the property as "complete".
    @JsonProperty("isComplete")
    private boolean complete;
}
