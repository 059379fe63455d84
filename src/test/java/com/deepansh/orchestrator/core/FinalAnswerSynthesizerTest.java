package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.llm.CompletionOptions;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolExecutionRecord;
import com.deepansh.orchestrator.model.ToolInvocationRequest;
import com.deepansh.orchestrator.observability.RunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinalAnswerSynthesizerTest {

    @Mock
    private LlmClient llmClient;

    private FinalAnswerSynthesizer synthesizer;

    private final List<Message> seed = List.of(Message.system("preamble"), Message.user("What changed?"));

    @BeforeEach
    void setUp() {
        synthesizer = new FinalAnswerSynthesizer(llmClient, new ToolRequestExtractor(), new OrchestratorProperties());
    }

    private static ToolExecutionRecord record(String tool, boolean error, String payload) {
        return new ToolExecutionRecord(ToolInvocationRequest.of(tool, Map.of()),
                Map.of(error ? "error" : "data", payload), error, 1);
    }

    @Test
    void synthesize_noRecords_returnsCurrentTextWithoutModelCall() {
        String answer = synthesizer.synthesize(seed, "What changed?", List.of(), "Partial text", new RunContext());

        assertThat(answer).isEqualTo("Partial text");
        verifyNoInteractions(llmClient);
    }

    @Test
    void synthesize_noRecordsNoText_returnsTimeoutAnswer() {
        assertThat(synthesizer.synthesize(seed, "q", List.of(), null, new RunContext()))
                .isEqualTo(FinalAnswerSynthesizer.NO_TOOLS_TIMEOUT_ANSWER);
    }

    @Test
    @SuppressWarnings("unchecked")
    void synthesize_withRecords_sendsSeedPlusEvidence() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.of("Three repositories were found."));

        String answer = synthesizer.synthesize(seed, "What changed?",
                List.of(record("search", false, "3 items")), "LISTO", new RunContext());

        assertThat(answer).isEqualTo("Three repositories were found.");

        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<CompletionOptions> options = ArgumentCaptor.forClass(CompletionOptions.class);
        verify(llmClient).chat(messages.capture(), options.capture());
        assertThat(messages.getValue()).hasSize(3);
        assertThat(messages.getValue().get(2).getContent())
                .contains("1. search: {data=3 items}")
                .contains("DO NOT request more tools");
        assertThat(options.getValue().maxTokens()).isEqualTo(1500);
    }

    @Test
    void buildEvidenceSummary_boundsCountAndLength() {
        List<ToolExecutionRecord> succeeded = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            succeeded.add(record("ok" + i, false, "s".repeat(3000)));
        }
        List<ToolExecutionRecord> failed = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            failed.add(record("bad" + i, true, "e".repeat(3000)));
        }

        String summary = synthesizer.buildEvidenceSummary(9, succeeded, failed);

        assertThat(summary).contains("Tools executed: 9 (5 succeeded, 4 failed)");
        assertThat(summary).contains("ok0", "ok1", "ok2").doesNotContain("ok3");
        assertThat(summary).contains("bad0", "bad1").doesNotContain("bad2");
        assertThat(summary).contains("s".repeat(990)).doesNotContain("s".repeat(1001));
        assertThat(summary).contains("e".repeat(490)).doesNotContain("e".repeat(501));
    }

    @Test
    void synthesize_modelStillRequestsTools_allFailed_returnsCannedAnswer() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.of(
                "```json\n{\"tool_request\": {\"tool_name\": \"again\", \"arguments\": {}}}\n```"));

        String answer = synthesizer.synthesize(seed, "q",
                List.of(record("a", true, "denied"), record("b", true, "denied")), null, new RunContext());

        assertThat(answer).isEqualTo(FinalAnswerSynthesizer.allFailedAnswer(2));
    }

    @Test
    void synthesize_modelStillRequestsTools_withSuccesses_returnsSuccessBasedAnswer() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.of(
                "{\"tool_request\": {\"tool_name\": \"again\", \"arguments\": {}}}"));

        String answer = synthesizer.synthesize(seed, "q",
                List.of(record("a", false, "ok"), record("b", true, "denied")), null, new RunContext());

        assertThat(answer).isEqualTo(FinalAnswerSynthesizer.successBasedAnswer(1, 1));
    }

    @Test
    void synthesize_emptyReply_returnsTimeoutVariant() {
        when(llmClient.chat(anyList(), any())).thenReturn(LlmResponse.empty());

        assertThat(synthesizer.synthesize(seed, "q", List.of(record("a", false, "ok")), null, new RunContext()))
                .isEqualTo(FinalAnswerSynthesizer.timedOutAnswer(1, 0));
        assertThat(synthesizer.synthesize(seed, "q", List.of(record("a", true, "x")), null, new RunContext()))
                .isEqualTo(FinalAnswerSynthesizer.timedOutAllFailedAnswer(1));
    }
}
