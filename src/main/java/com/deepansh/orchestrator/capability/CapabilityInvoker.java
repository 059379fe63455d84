package com.deepansh.orchestrator.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes one named capability from the session's catalog.
 *
 * Never throws: unknown names, provider errors and unexpected exceptions all
 * come back as {@code {"error": reason}} so the loop can classify them like
 * any other result.
 *
 * Results whose pretty-printed JSON exceeds the size cap are replaced by
 * {@code {"truncated_result": preview, "original_length": n}}.
 */
@Slf4j
public class CapabilityInvoker {

    public static final String ERROR_KEY = "error";
    public static final String TRUNCATED_KEY = "truncated_result";
    public static final String ORIGINAL_LENGTH_KEY = "original_length";

    private final CapabilityCatalog catalog;
    private final ObjectMapper objectMapper;
    private final int resultSizeCap;

    public CapabilityInvoker(CapabilityCatalog catalog, ObjectMapper objectMapper, int resultSizeCap) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.resultSizeCap = resultSizeCap;
    }

    public Map<String, Object> invoke(String name, Map<String, Object> arguments) {
        CapabilityFunction function = catalog.lookup(name).orElse(null);
        if (function == null) {
            String msg = String.format("Unknown capability '%s'. Available capabilities: %s", name, catalog.names());
            log.warn(msg);
            return Map.of(ERROR_KEY, msg);
        }

        log.info("Executing capability: [{}] with args: {}", name, arguments);

        Map<String, Object> result;
        try {
            result = function.apply(arguments != null ? arguments : Map.of());
        } catch (Exception e) {
            log.error("Unexpected error in capability [{}]", name, e);
            return Map.of(ERROR_KEY, "Error calling capability '" + name + "': " + e.getMessage());
        }

        if (result == null) {
            return Map.of(ERROR_KEY, "Capability '" + name + "' returned no result");
        }

        log.debug("Capability [{}] returned: {}", name, result);
        return capSize(result);
    }

    public CapabilityCatalog catalog() {
        return catalog;
    }

    private Map<String, Object> capSize(Map<String, Object> result) {
        String serialized = serialize(result);
        if (serialized.length() <= resultSizeCap) {
            return result;
        }
        log.info("Capability result truncated [{} -> {} chars]", serialized.length(), resultSizeCap);
        Map<String, Object> truncated = new LinkedHashMap<>();
        truncated.put(TRUNCATED_KEY, serialized.substring(0, resultSizeCap)
                + "\n... (result truncated, original length " + serialized.length() + " chars)");
        truncated.put(ORIGINAL_LENGTH_KEY, serialized.length());
        return truncated;
    }

    private String serialize(Map<String, Object> result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return String.valueOf(result);
        }
    }
}
