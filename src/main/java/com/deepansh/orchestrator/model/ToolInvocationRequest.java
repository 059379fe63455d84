package com.deepansh.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One tool call the model asked for, as extracted from its free-form reply.
 * Arguments are copied on construction and exposed read-only.
 */
public record ToolInvocationRequest(String name, Map<String, Object> arguments) {

    public ToolInvocationRequest {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolInvocationRequest of(String name, Map<String, Object> arguments) {
        return new ToolInvocationRequest(name, arguments);
    }
}
