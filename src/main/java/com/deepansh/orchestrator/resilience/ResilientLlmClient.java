package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.llm.CompletionOptions;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker.
 *
 * The circuit breaker sits inside the retry and has no fallback of its own, so
 * each failed attempt reaches the retry layer. Only the retry fallback turns the
 * final failure into an empty response: the orchestration loop reads "no content"
 * as a transport failure and either ends the run or does its single simplified retry.
 *
 * Retry config (in application.yml):
 * - 3 attempts, exponential backoff: 2s, 4s
 * - Retries on network errors, 429 and 5xx
 * - OrchestrationException and an open circuit (CallNotPermittedException) are not retried
 *
 * Circuit breaker config:
 * - Opens after 50% failure rate in sliding window of 10 calls
 * - Waits 30s before allowing probe calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "fallback")
    @CircuitBreaker(name = "llmClient")
    public LlmResponse chat(List<Message> messages, CompletionOptions options) {
        return delegate.chat(messages, options);
    }

    public LlmResponse fallback(List<Message> messages, CompletionOptions options, Exception ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        } else {
            log.error("LLM call failed after all retries: {}", ex.getMessage());
        }
        return LlmResponse.empty();
    }
}
