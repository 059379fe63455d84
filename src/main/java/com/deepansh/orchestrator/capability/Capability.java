package com.deepansh.orchestrator.capability;

import java.util.Map;

/**
 * Contract for in-process capabilities served by {@link LocalCapabilityProvider}.
 *
 * The {@link #getInputSchema()} return value is rendered into the capability
 * preamble so the model knows which arguments to send.
 *
 * Execution errors should NOT throw: return a map with an "error" key instead.
 * The invoker still catches anything that escapes.
 */
public interface Capability {

    /** Unique snake_case name the model uses to invoke this capability */
    String getName();

    /** Human-readable description, shown to the model in the preamble. */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the input parameters:
     * type, properties, required.
     */
    Map<String, Object> getInputSchema();

    /** Execute and return a structured result, or {@code {"error": reason}}. */
    Map<String, Object> invoke(Map<String, Object> arguments);
}
