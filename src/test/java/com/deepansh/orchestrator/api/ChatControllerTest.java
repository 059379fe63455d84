package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.capability.CapabilityCatalog;
import com.deepansh.orchestrator.capability.CapabilityProvider;
import com.deepansh.orchestrator.capability.CapabilityProviderFactory;
import com.deepansh.orchestrator.capability.LocalCapabilityProvider;
import com.deepansh.orchestrator.capability.impl.EchoCapability;
import com.deepansh.orchestrator.exception.GlobalExceptionHandler;
import com.deepansh.orchestrator.exception.OrchestrationException;
import com.deepansh.orchestrator.model.OrchestrationRequest;
import com.deepansh.orchestrator.model.OrchestrationResult;
import com.deepansh.orchestrator.model.TerminationReason;
import com.deepansh.orchestrator.session.BackgroundTaskSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock
    private BackgroundTaskSupervisor supervisor;

    @Mock
    private CapabilityProviderFactory providerFactory;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(supervisor, providerFactory))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void chat_validRequest_acknowledgesAndSubmits() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId": "s-1", "message": "How are the teams doing?",
                                 "userRole": "coordinador",
                                 "previousMessages": ["Hi", "Assistant: Hello"],
                                 "callbackUrl": "http://gateway/hook"}"""))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.messageType").value("status"))
                .andExpect(jsonPath("$.isComplete").value(false));

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(supervisor).submit(captor.capture());
        assertThat(captor.getValue().getQuery()).isEqualTo("How are the teams doing?");
        assertThat(captor.getValue().getHistory()).hasSize(2);
    }

    @Test
    void chat_missingCallback_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s-1\", \"message\": \"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.messageType").value("error"));

        verifyNoInteractions(supervisor);
    }

    @Test
    void chat_blankMessage_failsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s-1\", \"message\": \" \", \"callbackUrl\": \"http://h\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void chat_messageTooLong_failsValidation() throws Exception {
        String longMessage = "a".repeat(2001);
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s-1\", \"message\": \"" + longMessage + "\", \"callbackUrl\": \"http://h\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chat_saturated_returnsServerError() throws Exception {
        doThrow(new OrchestrationException("Too many concurrent sessions, try again later"))
                .when(supervisor).submit(any());

        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s-1\", \"message\": \"hi\", \"callbackUrl\": \"http://h\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Too many concurrent sessions, try again later"));
    }

    @Test
    void chatSync_returnsOrchestrationResult() throws Exception {
        when(supervisor.runSynchronously(any())).thenReturn(OrchestrationResult.builder()
                .sessionId("s-1")
                .finalAnswer("The answer is 42")
                .iterationsUsed(1)
                .terminationReason(TerminationReason.DIRECT_ANSWER)
                .build());

        mockMvc.perform(post("/api/v1/chat/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s-1\", \"message\": \"What is the answer?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalAnswer").value("The answer is 42"))
                .andExpect(jsonPath("$.terminationReason").value("DIRECT_ANSWER"));
    }

    @Test
    void capabilities_listsCatalogAndClosesProvider() throws Exception {
        CapabilityProvider provider = new LocalCapabilityProvider(List.of(new EchoCapability()));
        when(providerFactory.open()).thenReturn(provider);
        when(providerFactory.catalogFor(provider)).thenReturn(CapabilityCatalog.fromProvider(provider, List.of()));

        mockMvc.perform(get("/api/v1/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("echo"));

        assertThat(((LocalCapabilityProvider) provider).isOpen()).isFalse();
    }

    @Test
    void health_returnsUp() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
