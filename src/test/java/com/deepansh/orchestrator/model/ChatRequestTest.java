package com.deepansh.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatRequestTest {

    @Test
    void toHistory_mapsPrefixesToRoles() {
        ChatRequest request = new ChatRequest();
        request.setPreviousMessages(Arrays.asList(
                "How many teams are there?",
                "Assistant: There are four teams.",
                "Asistente: Hay cuatro equipos.",
                "User: And students?",
                "",
                null));

        List<Message> history = request.toHistory();

        assertThat(history).extracting(Message::getRole).containsExactly(
                Message.Role.user, Message.Role.assistant, Message.Role.assistant, Message.Role.user);
        assertThat(history).extracting(Message::getContent).containsExactly(
                "How many teams are there?", "There are four teams.", "Hay cuatro equipos.", "And students?");
    }

    @Test
    void toOrchestrationRequest_copiesFields() {
        ChatRequest request = new ChatRequest();
        request.setSessionId("s-1");
        request.setMessage("Summarize team progress");
        request.setUserRole("coordinador");
        request.setCallbackUrl("http://gateway/hook");

        OrchestrationRequest orchestration = request.toOrchestrationRequest();

        assertThat(orchestration.getSessionId()).isEqualTo("s-1");
        assertThat(orchestration.getQuery()).isEqualTo("Summarize team progress");
        assertThat(orchestration.getUserRole()).isEqualTo("coordinador");
        assertThat(orchestration.getCallbackUrl()).isEqualTo("http://gateway/hook");
        assertThat(orchestration.getHistory()).isEmpty();
    }
}
