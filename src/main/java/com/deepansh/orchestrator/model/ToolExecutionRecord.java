package com.deepansh.orchestrator.model;

import java.util.Map;

/**
 * Outcome of executing one {@link ToolInvocationRequest} within an iteration.
 * {@code error} is always resolved, either by the model classifier or the keyword fallback.
 */
public record ToolExecutionRecord(
        ToolInvocationRequest request,
        Map<String, Object> rawResult,
        boolean error,
        int iterationIndex
) {

    public String toolName() {
        return request.name();
    }

    public boolean succeeded() {
        return !error;
    }
}
