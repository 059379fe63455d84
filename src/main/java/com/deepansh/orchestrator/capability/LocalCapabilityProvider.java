package com.deepansh.orchestrator.capability;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves the in-process {@link Capability} beans. Used when no MCP server is configured.
 */
@Slf4j
public class LocalCapabilityProvider implements CapabilityProvider {

    private final Map<String, Capability> capabilities = new LinkedHashMap<>();
    private volatile boolean open = true;

    public LocalCapabilityProvider(List<Capability> capabilityBeans) {
        capabilityBeans.forEach(c -> capabilities.put(c.getName(), c));
    }

    @Override
    public List<CapabilityDescriptor> listCapabilities() {
        return capabilities.values().stream().map(CapabilityDescriptor::from).toList();
    }

    @Override
    public Map<String, Object> call(String name, Map<String, Object> arguments) {
        if (!open) {
            throw new IllegalStateException("Local capability provider is closed");
        }
        Capability capability = capabilities.get(name);
        if (capability == null) {
            return Map.of(CapabilityInvoker.ERROR_KEY, "Capability '" + name + "' not available");
        }
        return capability.invoke(arguments);
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        log.debug("Local capability provider closed");
    }
}
