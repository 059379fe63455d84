package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.capability.CapabilityDescriptor;
import com.deepansh.orchestrator.capability.CapabilityProvider;
import com.deepansh.orchestrator.capability.CapabilityProviderFactory;
import com.deepansh.orchestrator.model.ChatAcknowledgement;
import com.deepansh.orchestrator.model.ChatRequest;
import com.deepansh.orchestrator.model.OrchestrationResult;
import com.deepansh.orchestrator.session.BackgroundTaskSupervisor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Chat endpoints.
 *
 * POST /api/v1/chat            queue a session, answer arrives on callbackUrl
 * POST /api/v1/chat/sync       run the loop in the request thread, no webhook
 * GET  /api/v1/capabilities    validated catalog of the configured provider
 * GET  /api/v1/health
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String ACCEPTED_MESSAGE = "Processing your request...";

    private final BackgroundTaskSupervisor supervisor;
    private final CapabilityProviderFactory providerFactory;

    @PostMapping("/chat")
    public ResponseEntity<ChatAcknowledgement> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [sessionId={}, userRole={}, history={}]",
                request.getSessionId(), request.getUserRole(),
                request.getPreviousMessages() != null ? request.getPreviousMessages().size() : 0);

        if (request.getCallbackUrl() == null || request.getCallbackUrl().isBlank()) {
            return ResponseEntity.badRequest().body(ChatAcknowledgement.error(
                    request.getSessionId(), "callbackUrl is required for asynchronous chat"));
        }

        supervisor.submit(request.toOrchestrationRequest());
        return ResponseEntity.accepted().body(ChatAcknowledgement.status(request.getSessionId(), ACCEPTED_MESSAGE));
    }

    @PostMapping("/chat/sync")
    public ResponseEntity<OrchestrationResult> chatSync(@Valid @RequestBody ChatRequest request) {
        log.info("Synchronous chat request [sessionId={}, userRole={}]",
                request.getSessionId(), request.getUserRole());
        return ResponseEntity.ok(supervisor.runSynchronously(request.toOrchestrationRequest()));
    }

    @GetMapping("/capabilities")
    public ResponseEntity<List<CapabilityDescriptor>> capabilities() {
        try (CapabilityProvider provider = providerFactory.open()) {
            return ResponseEntity.ok(providerFactory.catalogFor(provider).descriptors());
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
