package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.llm.CompletionOptions;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolInvocationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether one tool result is an error.
 *
 * Asks the model for a single word, ERROR or SUCCESS, at near-zero temperature.
 * The result is an error only if "ERROR" literally appears in the upper-cased
 * reply. A reply containing neither word counts as success
 * ({@link #AMBIGUOUS_REPLY_IS_ERROR}). When the call itself returns nothing,
 * the keyword heuristic decides.
 *
 * Works on its own one-message conversation; never touches the session's context.
 */
@Component
@Slf4j
public class ResultClassifier {

    static final String ERROR_TOKEN = "ERROR";
    static final String SUCCESS_TOKEN = "SUCCESS";

    /** Policy for replies that contain neither token. */
    public static final boolean AMBIGUOUS_REPLY_IS_ERROR = false;

    private static final String PROMPT_TEMPLATE = """
            Analyze this tool result and decide whether it is an ERROR or a SUCCESS.

            TOOL USED: %s
            ARGUMENTS: %s
            RESULT: %s

            CRITERIA:
            - ERROR if it contains error messages, missing parameters, resources not found, \
            denied permissions or a malformed request
            - SUCCESS if it returns valid data, lists, or objects with useful information

            Answer with ONLY one word: "ERROR" or "SUCCESS\"""";

    private final LlmClient llmClient;
    private final HeuristicResultClassifier heuristic;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties.Classifier config;

    public ResultClassifier(LlmClient llmClient,
                            HeuristicResultClassifier heuristic,
                            ObjectMapper objectMapper,
                            OrchestratorProperties properties) {
        this.llmClient = llmClient;
        this.heuristic = heuristic;
        this.objectMapper = objectMapper;
        this.config = properties.getClassifier();
    }

    /**
     * @return true when the result should be treated as a failure
     */
    public boolean isError(ToolInvocationRequest request, Map<String, Object> result) {
        LlmResponse reply;
        try {
            reply = llmClient.chat(List.of(Message.user(buildPrompt(request, result))),
                    CompletionOptions.of(config.getTemperature(), config.getMaxTokens()));
        } catch (RuntimeException e) {
            log.warn("Classification call failed for [{}], using keyword fallback: {}",
                    request.name(), e.getMessage());
            return heuristic.isError(result);
        }

        if (reply == null || reply.isEmpty()) {
            log.warn("Classification model returned nothing for [{}], using keyword fallback", request.name());
            return heuristic.isError(result);
        }

        boolean isError = interpret(reply.getContent());
        log.info("Classifier judged [{}] as {}", request.name(), isError ? ERROR_TOKEN : SUCCESS_TOKEN);
        return isError;
    }

    static boolean interpret(String reply) {
        String normalized = reply.strip().toUpperCase(Locale.ROOT);
        if (normalized.contains(ERROR_TOKEN)) return true;
        if (normalized.contains(SUCCESS_TOKEN)) return false;
        log.warn("Classifier reply contained neither token: '{}', applying ambiguity policy", reply.strip());
        return AMBIGUOUS_REPLY_IS_ERROR;
    }

    String buildPrompt(ToolInvocationRequest request, Map<String, Object> result) {
        String resultJson = toPrettyJson(result);
        if (resultJson.length() > config.getResultPreviewChars()) {
            resultJson = resultJson.substring(0, config.getResultPreviewChars());
        }
        return PROMPT_TEMPLATE.formatted(request.name(), toPrettyJson(request.arguments()), resultJson);
    }

    private String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
