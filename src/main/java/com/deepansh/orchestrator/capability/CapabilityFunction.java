package com.deepansh.orchestrator.capability;

import java.util.Map;

/**
 * Invocation function registered in a {@link CapabilityCatalog} under one capability name.
 */
@FunctionalInterface
public interface CapabilityFunction {

    Map<String, Object> apply(Map<String, Object> arguments);
}
