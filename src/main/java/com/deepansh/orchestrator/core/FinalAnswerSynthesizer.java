package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.llm.CompletionOptions;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolExecutionRecord;
import com.deepansh.orchestrator.observability.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the answer returned to the caller once the loop stops.
 *
 * One more model call over the seed conversation plus a bounded evidence summary.
 * The model is never allowed to start another round from here: a reply that still
 * looks like a tool request is replaced by a canned answer built from the counts.
 */
@Component
@Slf4j
public class FinalAnswerSynthesizer {

    static final String NO_TOOLS_TIMEOUT_ANSWER = "Tools could not be executed due to a timeout.";

    private static final String FINAL_TEMPLATE = """
            Based on these tool results:

            %s
            Answer the original question: %s

            INSTRUCTIONS:
            - If you have successful results, use them to answer completely
            - If you only have errors, explain what was attempted and why it did not work
            - If you have a mix, answer with the available information and mention the limitations
            - Be concise but complete

            IMPORTANT: DO NOT request more tools. Answer directly with the available information.""";

    private final LlmClient llmClient;
    private final ToolRequestExtractor extractor;
    private final OrchestratorProperties.Evidence evidence;
    private final OrchestratorProperties.Loop loop;

    public FinalAnswerSynthesizer(LlmClient llmClient,
                                  ToolRequestExtractor extractor,
                                  OrchestratorProperties properties) {
        this.llmClient = llmClient;
        this.extractor = extractor;
        this.evidence = properties.getEvidence();
        this.loop = properties.getLoop();
    }

    /**
     * @param seedMessages  system preamble, history and query; iteration exchanges are left out
     * @param currentText   the last model reply of the loop, possibly null
     */
    public String synthesize(List<Message> seedMessages,
                             String originalQuestion,
                             List<ToolExecutionRecord> records,
                             String currentText,
                             RunContext runCtx) {
        if (records.isEmpty()) {
            return currentText != null && !currentText.isBlank() ? currentText : NO_TOOLS_TIMEOUT_ANSWER;
        }

        List<ToolExecutionRecord> succeeded = records.stream().filter(ToolExecutionRecord::succeeded).toList();
        List<ToolExecutionRecord> failed = records.stream().filter(ToolExecutionRecord::error).toList();

        List<Message> messages = new ArrayList<>(seedMessages);
        messages.add(Message.user(FINAL_TEMPLATE.formatted(
                buildEvidenceSummary(records.size(), succeeded, failed), originalQuestion)));

        log.info("Generating final answer ({} succeeded, {} failed)", succeeded.size(), failed.size());
        LlmResponse reply = llmClient.chat(messages, CompletionOptions.maxTokens(loop.getFinalAnswerMaxTokens()));
        runCtx.recordModelCall(reply);

        if (reply == null || reply.isEmpty()) {
            log.warn("Final answer generation returned nothing, using canned answer");
            return succeeded.isEmpty()
                    ? timedOutAllFailedAnswer(records.size())
                    : timedOutAnswer(succeeded.size(), failed.size());
        }

        if (extractor.looksLikeToolRequest(reply.getContent())) {
            log.warn("Model kept requesting tools during final answer, discarding reply");
            return succeeded.isEmpty()
                    ? allFailedAnswer(records.size())
                    : successBasedAnswer(succeeded.size(), failed.size());
        }

        return reply.getContent();
    }

    static String successBasedAnswer(int succeeded, int failed) {
        return ("Based on the %d successful tool results obtained, the necessary tools were executed. "
                + "The results include information relevant to your query. "
                + "%d tools failed but enough data was gathered for the analysis.").formatted(succeeded, failed);
    }

    static String allFailedAnswer(int attempted) {
        return ("Attempted to execute %d tools, but all of them failed. The most common causes were access "
                + "problems, incorrect parameters or resources not found. You may need to verify the names "
                + "of the resources involved or your access permissions.").formatted(attempted);
    }

    static String timedOutAnswer(int succeeded, int failed) {
        return ("Executed %d tools successfully (and %d failed), but generating the final answer timed out. "
                + "The successful results are available.").formatted(succeeded, failed);
    }

    static String timedOutAllFailedAnswer(int attempted) {
        return ("Attempted to execute %d tools but all of them failed. The errors include access problems, "
                + "incorrect parameters or resources not found.").formatted(attempted);
    }

    String buildEvidenceSummary(int total,
                                List<ToolExecutionRecord> succeeded,
                                List<ToolExecutionRecord> failed) {
        StringBuilder summary = new StringBuilder()
                .append("Tools executed: ").append(total)
                .append(" (").append(succeeded.size()).append(" succeeded, ")
                .append(failed.size()).append(" failed)\n");

        if (!succeeded.isEmpty()) {
            summary.append("\nSUCCESSFUL RESULTS:\n");
            appendPreviews(summary, succeeded, evidence.getMaxSuccesses(), evidence.getSuccessPreviewChars());
        }
        if (!failed.isEmpty()) {
            summary.append("\nERRORS FOUND:\n");
            appendPreviews(summary, failed, evidence.getMaxFailures(), evidence.getFailurePreviewChars());
        }
        return summary.toString();
    }

    private static void appendPreviews(StringBuilder summary, List<ToolExecutionRecord> records,
                                       int limit, int previewChars) {
        for (int i = 0; i < Math.min(limit, records.size()); i++) {
            ToolExecutionRecord record = records.get(i);
            String preview = String.valueOf(record.rawResult());
            if (preview.length() > previewChars) {
                preview = preview.substring(0, previewChars);
            }
            summary.append(i + 1).append(". ").append(record.toolName()).append(": ")
                    .append(preview).append("...\n");
        }
    }
}
