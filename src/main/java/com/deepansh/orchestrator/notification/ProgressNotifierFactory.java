package com.deepansh.orchestrator.notification;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands each session its own {@link ProgressNotifier}. The caller owns and closes it.
 */
@Component
@RequiredArgsConstructor
public class ProgressNotifierFactory {

    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;

    public ProgressNotifier create() {
        return new ProgressNotifier(objectMapper, properties.getNotifier().getTimeout());
    }
}
