package com.deepansh.orchestrator.capability.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EchoCapabilityTest {

    private final EchoCapability capability = new EchoCapability();

    @Test
    void getName_returnsEcho() {
        assertThat(capability.getName()).isEqualTo("echo");
    }

    @Test
    void invoke_withMessage_echoesIt() {
        assertThat(capability.invoke(Map.of("message", "hello"))).containsEntry("echo", "hello");
    }

    @Test
    void invoke_missingMessage_returnsErrorMap() {
        assertThat(capability.invoke(Map.of()))
                .containsEntry("error", "missing required parameter: message");
    }
}
