package com.deepansh.orchestrator.capability;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

/**
 * Connection to whatever actually executes capabilities (an MCP server, local beans).
 * Owned by exactly one session and closed when that session ends.
 */
public interface CapabilityProvider extends Closeable {

    /** Capabilities this provider currently offers. */
    List<CapabilityDescriptor> listCapabilities();

    /**
     * Execute one capability. May return {@code {"error": reason}} for failures the
     * provider itself reports; may throw for transport failures.
     */
    Map<String, Object> call(String name, Map<String, Object> arguments);

    /** Close without a checked exception; providers hold no resources that need one. */
    @Override
    void close();
}
