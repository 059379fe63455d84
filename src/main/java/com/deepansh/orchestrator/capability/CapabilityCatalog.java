package com.deepansh.orchestrator.capability;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit name -> invocation function map for one session.
 *
 * Built once from what the provider advertises, filtered by the configured
 * allowlist. Anything not registered here cannot be invoked, whatever name the
 * model writes.
 */
@Slf4j
public final class CapabilityCatalog {

    private final Map<String, CapabilityDescriptor> descriptors;
    private final Map<String, CapabilityFunction> functions;

    private CapabilityCatalog(Map<String, CapabilityDescriptor> descriptors,
                              Map<String, CapabilityFunction> functions) {
        this.descriptors = Collections.unmodifiableMap(descriptors);
        this.functions = Collections.unmodifiableMap(functions);
    }

    /**
     * Register every capability of {@code provider} whose name passes {@code allowed}.
     * An empty allowlist admits everything. Allowlisted names the provider does not
     * offer are reported and skipped.
     */
    public static CapabilityCatalog fromProvider(CapabilityProvider provider, Collection<String> allowed) {
        Set<String> allowlist = allowed == null ? Set.of() : Set.copyOf(allowed);
        Map<String, CapabilityDescriptor> descriptors = new LinkedHashMap<>();
        Map<String, CapabilityFunction> functions = new LinkedHashMap<>();

        List<CapabilityDescriptor> offered = provider.listCapabilities();
        for (CapabilityDescriptor descriptor : offered) {
            String name = descriptor.getName();
            if (name == null || name.isBlank()) continue;
            if (!allowlist.isEmpty() && !allowlist.contains(name)) {
                log.debug("Capability [{}] offered but not allowlisted, skipping", name);
                continue;
            }
            if (descriptors.putIfAbsent(name, descriptor) != null) {
                log.warn("Duplicate capability name [{}] from provider, keeping the first", name);
                continue;
            }
            functions.put(name, arguments -> provider.call(name, arguments));
        }

        Set<String> offeredNames = offered.stream().map(CapabilityDescriptor::getName).collect(Collectors.toSet());
        allowlist.stream()
                .filter(name -> !offeredNames.contains(name))
                .forEach(name -> log.warn("Allowlisted capability [{}] is not offered by the provider", name));

        log.info("Capability catalog built: {} registered, {} restricted",
                descriptors.size(), offered.size() - descriptors.size());
        return new CapabilityCatalog(descriptors, functions);
    }

    public Optional<CapabilityFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return descriptors.keySet();
    }

    public List<CapabilityDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }
}
