package com.deepansh.orchestrator.capability;

import com.deepansh.orchestrator.capability.mcp.McpCapabilityProvider;
import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Opens one capability provider per session: the configured MCP server, or the
 * in-process {@link Capability} beans when no MCP command is set.
 * Callers own the returned provider and must close it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CapabilityProviderFactory {

    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;
    private final List<Capability> localCapabilities;

    public CapabilityProvider open() {
        OrchestratorProperties.Capabilities.Mcp mcp = properties.getCapabilities().getMcp();
        if (mcp.isConfigured()) {
            return new McpCapabilityProvider(mcp, objectMapper).start();
        }
        log.debug("No MCP command configured, using {} local capabilities", localCapabilities.size());
        return new LocalCapabilityProvider(localCapabilities);
    }

    /** Validated catalog for a freshly opened provider. */
    public CapabilityCatalog catalogFor(CapabilityProvider provider) {
        return CapabilityCatalog.fromProvider(provider, properties.getCapabilities().getAllowed());
    }

    public CapabilityInvoker invokerFor(CapabilityCatalog catalog) {
        return new CapabilityInvoker(catalog, objectMapper, properties.getLoop().getResultSizeCap());
    }
}
