package com.deepansh.orchestrator.capability.impl;

import com.deepansh.orchestrator.capability.Capability;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Smoke-test capability to verify the orchestration loop end-to-end without an MCP server.
 */
@Component
public class EchoCapability implements Capability {

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Echoes back the provided message. Use this to test that tool execution is working.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "The message to echo back"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        Object message = arguments.get("message");
        if (message == null) {
            return Map.of("error", "missing required parameter: message");
        }
        return Map.of("echo", message.toString());
    }
}
