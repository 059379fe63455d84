package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.capability.CapabilityCatalog;
import com.deepansh.orchestrator.capability.CapabilityDescriptor;
import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.model.Message;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Builds the system message: optional role persona, the capability list and the
 * JSON request format the extractor understands.
 */
@Component
public class SystemPromptBuilder {

    private static final String TEMPLATE = """
            You are an intelligent assistant with access to external tools.

            AVAILABLE TOOLS (* marks required parameters):
            %s

            INSTRUCTIONS:
            - If you need specific information that a tool can provide, request it with this exact JSON format:
            ```json
            {
              "%s": {
                "%s": "tool_name",
                "%s": { "param": "value" }
              },
              "reason": "why you need this tool"
            }
            ```
            - You may request several tools at once, one JSON block per tool. They run in the order given.
            - Use only the tools listed above and include every required parameter.
            - When you already have enough information, or you are told not to use more tools, answer directly.
            - If you are asked whether you need more tools and you do not, reply "%s".
            - If you need no tools at all, simply answer normally.""";

    private final OrchestratorProperties properties;

    public SystemPromptBuilder(OrchestratorProperties properties) {
        this.properties = properties;
    }

    public Message build(String userRole, CapabilityCatalog catalog) {
        String toolLines = catalog.isEmpty()
                ? "(no tools available)"
                : catalog.descriptors().stream()
                        .map(CapabilityDescriptor::toPromptLine)
                        .collect(Collectors.joining("\n"));

        String preamble = TEMPLATE.formatted(
                toolLines,
                ToolRequestExtractor.REQUEST_FIELD,
                ToolRequestExtractor.NAME_FIELD,
                ToolRequestExtractor.ARGUMENTS_FIELD,
                properties.getLoop().getSentinel());

        String persona = properties.personaFor(userRole);
        return Message.system(persona != null ? persona.strip() + "\n\n" + preamble : preamble);
    }
}
