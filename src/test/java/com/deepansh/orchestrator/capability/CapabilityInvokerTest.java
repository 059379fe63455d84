package com.deepansh.orchestrator.capability;

import com.deepansh.orchestrator.capability.impl.EchoCapability;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CapabilityInvokerTest {

    private CapabilityProvider provider;
    private CapabilityInvoker invoker;

    @BeforeEach
    void setUp() {
        provider = mock(CapabilityProvider.class);
        when(provider.listCapabilities()).thenReturn(List.of(
                CapabilityDescriptor.builder().name("big").description("returns a lot").build(),
                CapabilityDescriptor.builder().name("flaky").description("throws").build(),
                CapabilityDescriptor.builder().name("small").description("returns little").build()));
        invoker = new CapabilityInvoker(CapabilityCatalog.fromProvider(provider, List.of()), new ObjectMapper(), 5000);
    }

    @Test
    void invoke_resultOverCap_isReplacedByTruncatedPreview() {
        when(provider.call(eq("big"), any())).thenReturn(Map.of("blob", "x".repeat(12_000)));

        Map<String, Object> result = invoker.invoke("big", Map.of());

        assertThat(result).containsOnlyKeys(CapabilityInvoker.TRUNCATED_KEY, CapabilityInvoker.ORIGINAL_LENGTH_KEY);
        int originalLength = (Integer) result.get(CapabilityInvoker.ORIGINAL_LENGTH_KEY);
        assertThat(originalLength).isGreaterThan(12_000);
        assertThat((String) result.get(CapabilityInvoker.TRUNCATED_KEY))
                .startsWith("{")
                .endsWith("(result truncated, original length " + originalLength + " chars)")
                .hasSizeLessThan(5100);
    }

    @Test
    void invoke_resultUnderCap_isReturnedAsIs() {
        Map<String, Object> payload = Map.of("items", List.of("a", "b"));
        when(provider.call(eq("small"), any())).thenReturn(payload);

        assertThat(invoker.invoke("small", Map.of("q", "x"))).isEqualTo(payload);
    }

    @Test
    void invoke_unknownName_returnsErrorListingAvailable() {
        Map<String, Object> result = invoker.invoke("nope", Map.of());

        assertThat(result.get(CapabilityInvoker.ERROR_KEY).toString())
                .contains("Unknown capability 'nope'")
                .contains("big", "flaky", "small");
    }

    @Test
    void invoke_providerThrows_returnsErrorInsteadOfThrowing() {
        when(provider.call(eq("flaky"), any())).thenThrow(new IllegalStateException("socket closed"));

        assertThat(invoker.invoke("flaky", Map.of()))
                .containsEntry(CapabilityInvoker.ERROR_KEY, "Error calling capability 'flaky': socket closed");
    }

    @Test
    void invoke_nullResult_returnsError() {
        when(provider.call(eq("small"), any())).thenReturn(null);

        assertThat(invoker.invoke("small", null)).containsKey(CapabilityInvoker.ERROR_KEY);
    }

    @Test
    void invoke_localEcho_roundTripsThroughLocalProvider() {
        CapabilityInvoker local = new CapabilityInvoker(
                CapabilityCatalog.fromProvider(new LocalCapabilityProvider(List.of(new EchoCapability())), List.of()),
                new ObjectMapper(), 5000);

        assertThat(local.invoke("echo", Map.of("message", "hi"))).containsEntry("echo", "hi");
    }
}
