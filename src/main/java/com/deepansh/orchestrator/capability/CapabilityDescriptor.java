package com.deepansh.orchestrator.capability;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a capability's name and schema as advertised by a provider.
 * Decouples the preamble format from where the capability actually lives.
 */
@Data
@Builder
public class CapabilityDescriptor {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static CapabilityDescriptor from(Capability capability) {
        return CapabilityDescriptor.builder()
                .name(capability.getName())
                .description(capability.getDescription())
                .inputSchema(capability.getInputSchema())
                .build();
    }

    /**
     * Parameter names in schema order, required ones first and suffixed with {@code *}.
     */
    @SuppressWarnings("unchecked")
    public List<String> parameterSummary() {
        if (inputSchema == null || !(inputSchema.get("properties") instanceof Map<?, ?> properties)) {
            return List.of();
        }
        Collection<Object> required = inputSchema.get("required") instanceof Collection<?> r
                ? (Collection<Object>) r
                : List.of();

        List<String> requiredParams = new ArrayList<>();
        List<String> optionalParams = new ArrayList<>();
        for (Object key : properties.keySet()) {
            String param = String.valueOf(key);
            if (required.contains(param)) {
                requiredParams.add(param + "*");
            } else {
                optionalParams.add(param);
            }
        }
        requiredParams.addAll(optionalParams);
        return requiredParams;
    }

    /** One preamble line, e.g. {@code - search_repositories(query*, page)}, followed by the description. */
    public String toPromptLine() {
        List<String> params = parameterSummary();
        StringBuilder line = new StringBuilder("- ").append(name)
                .append(params.isEmpty() ? "(no parameters)" : "(" + String.join(", ", params) + ")");
        if (description != null && !description.isBlank()) {
            line.append("\n  ").append(description.strip());
        }
        return line.toString();
    }
}
