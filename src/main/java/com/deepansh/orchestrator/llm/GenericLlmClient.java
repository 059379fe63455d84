package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.OrchestrationException;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion client. Works with DeepSeek and OpenAI.
 *
 * Tool use is negotiated in plain text (the model writes JSON blocks), so no
 * "tools" field is ever sent.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                          |
 * |------------------------|-------------------------------------------------|
 * | 401 invalid key        | OrchestrationException (not retried)            |
 * | 429 rate limit         | RuntimeException (retried, counts as failure)   |
 * | 400 / other 4xx        | OrchestrationException (not retried)            |
 * | 5xx server error       | RuntimeException (retried, counts as failure)   |
 * | network error/timeout  | ResourceAccessException (retried)               |
 * | no choices / no text   | empty LlmResponse                               |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, CompletionOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, options);

        log.debug("Sending {} messages to {} [model={}, maxTokens={}]",
                messages.size(), providerName, props.getModel(), requestBody.get("max_tokens"));

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new OrchestrationException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new OrchestrationException(providerName + " client error [" + statusCode + "]: " + body);
    }

    Map<String, Object> buildRequestBody(List<Message> messages, CompletionOptions options) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(msg -> Map.<String, Object>of(
                        "role", msg.getRole().name(),
                        "content", msg.getContent() != null ? msg.getContent() : ""))
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", options.maxTokens() != null ? options.maxTokens() : props.getMaxTokens());
        body.put("temperature", options.temperature() != null ? options.temperature() : props.getTemperature());
        body.put("messages", formattedMessages);
        body.put("stream", false);
        return body;
    }

    @SuppressWarnings("unchecked")
    LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            log.warn("{} returned an empty body", providerName);
            return LlmResponse.empty();
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            log.warn("{} returned no choices in response", providerName);
            return LlmResponse.empty();
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;

        return LlmResponse.builder()
                .content(content)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
