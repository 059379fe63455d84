package com.deepansh.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
public class ChatRequest {

    private static final List<String> ASSISTANT_PREFIXES = List.of("assistant:", "asistente:");

    @NotBlank(message = "sessionId must not be blank")
    private String sessionId;

    @NotBlank(message = "message must not be blank")
    @Size(max = 2000, message = "message must be at most 2000 characters")
    private String message;

    /** Optional. Selects a configured persona, e.g. "coordinador" or "profesor". */
    private String userRole;

    /**
     * Prior turns as plain strings. Entries starting with "Assistant:" / "Asistente:"
     * are replayed as assistant messages, everything else as user messages.
     */
    private List<String> previousMessages = new ArrayList<>();

    /** Required for the async endpoint; ignored by the sync one. */
    private String callbackUrl;

    public List<Message> toHistory() {
        if (previousMessages == null) return List.of();
        List<Message> history = new ArrayList<>();
        for (String entry : previousMessages) {
            if (entry == null || entry.isBlank()) continue;
            String lower = entry.toLowerCase(Locale.ROOT);
            String prefix = ASSISTANT_PREFIXES.stream().filter(lower::startsWith).findFirst().orElse(null);
            if (prefix != null) {
                history.add(Message.assistant(entry.substring(prefix.length()).trim()));
            } else if (lower.startsWith("user:") || lower.startsWith("usuario:")) {
                history.add(Message.user(entry.substring(entry.indexOf(':') + 1).trim()));
            } else {
                history.add(Message.user(entry.trim()));
            }
        }
        return history;
    }

    public OrchestrationRequest toOrchestrationRequest() {
        return OrchestrationRequest.builder()
                .sessionId(sessionId)
                .query(message)
                .callbackUrl(callbackUrl)
                .userRole(userRole)
                .history(toHistory())
                .build();
    }
}
