package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.capability.CapabilityInvoker;
import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.exception.OrchestrationException;
import com.deepansh.orchestrator.llm.CompletionOptions;
import com.deepansh.orchestrator.llm.LlmClient;
import com.deepansh.orchestrator.model.IterationOutcome;
import com.deepansh.orchestrator.model.LlmResponse;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.OrchestrationRequest;
import com.deepansh.orchestrator.model.OrchestrationResult;
import com.deepansh.orchestrator.model.TerminationReason;
import com.deepansh.orchestrator.model.ToolExecutionRecord;
import com.deepansh.orchestrator.model.ToolInvocationRequest;
import com.deepansh.orchestrator.observability.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Core tool orchestration loop (Ask → Execute → Classify → Follow up).
 *
 * Per-run flow:
 * 1. Seed the conversation: persona + capability preamble, caller history, query
 * 2. Ask the model; a reply without a tool request is returned as-is
 * 3. Per iteration: extract every request, run them one after another,
 *    classify each result, send the follow-up matching the outcome
 * 4. Stop on the sentinel, when no more requests come back, when the model
 *    stays silent after one simplified retry, or when the budget runs out
 * 5. Synthesize the final answer from a bounded evidence summary
 *
 * Progress is published to the supplied listener; the terminal update is left
 * to the caller.
 */
@Service
@Slf4j
public class OrchestrationLoop {

    private final LlmClient llmClient;
    private final ToolRequestExtractor extractor;
    private final ResultClassifier classifier;
    private final SystemPromptBuilder systemPromptBuilder;
    private final FollowUpPromptBuilder followUpPromptBuilder;
    private final FinalAnswerSynthesizer synthesizer;
    private final OrchestratorProperties.Loop config;

    public OrchestrationLoop(LlmClient llmClient,
                             ToolRequestExtractor extractor,
                             ResultClassifier classifier,
                             SystemPromptBuilder systemPromptBuilder,
                             FollowUpPromptBuilder followUpPromptBuilder,
                             FinalAnswerSynthesizer synthesizer,
                             OrchestratorProperties properties) {
        this.llmClient = llmClient;
        this.extractor = extractor;
        this.classifier = classifier;
        this.systemPromptBuilder = systemPromptBuilder;
        this.followUpPromptBuilder = followUpPromptBuilder;
        this.synthesizer = synthesizer;
        this.config = properties.getLoop();
    }

    public OrchestrationResult run(OrchestrationRequest request,
                                   CapabilityInvoker invoker,
                                   ProgressListener listener) {
        String sessionId = request.getSessionId();
        String query = request.getQuery();
        int maxIterations = config.getMaxIterations();

        log.info("Orchestration started [sessionId={}, capabilities={}, query='{}']",
                sessionId, invoker.catalog().size(), query);

        RunContext runCtx = new RunContext();
        ConversationContext context = ConversationContext.seed(
                systemPromptBuilder.build(request.getUserRole(), invoker.catalog()),
                request.getHistory(),
                query);

        String current = ask(context.messages(), CompletionOptions.defaults(), runCtx);
        if (isEmpty(current)) {
            log.warn("Model returned nothing for the initial query, retrying with simplified context [sessionId={}]",
                    sessionId);
            current = simplifiedRetry(query, 0, runCtx);
        }

        if (isEmpty(current)) {
            return finish(request, context, List.of(), List.of(), null, 1,
                    TerminationReason.MODEL_UNAVAILABLE, runCtx, listener);
        }
        if (!extractor.looksLikeToolRequest(current)) {
            log.info("Model answered directly [sessionId={}]", sessionId);
            return finish(request, context, List.of(), List.of(), current, 1,
                    TerminationReason.DIRECT_ANSWER, runCtx, listener);
        }

        List<ToolExecutionRecord> records = new ArrayList<>();
        List<ToolInvocationRequest> executed = new ArrayList<>();
        TerminationReason reason = null;
        int iteration = 0;

        while (reason == null) {
            if (!extractor.looksLikeToolRequest(current)) {
                reason = TerminationReason.NO_MORE_REQUESTS;
                break;
            }
            if (iteration >= maxIterations) {
                log.warn("Iteration budget of {} exhausted [sessionId={}]", maxIterations, sessionId);
                reason = TerminationReason.BUDGET_EXHAUSTED;
                break;
            }

            List<ToolInvocationRequest> requests = extractor.extract(current);
            if (requests.isEmpty()) {
                log.info("Reply looked like a tool request but none could be parsed [sessionId={}]", sessionId);
                reason = TerminationReason.NO_MORE_REQUESTS;
                break;
            }

            iteration++;
            log.info("Iteration {}/{} with {} tool request(s) [sessionId={}]",
                    iteration, maxIterations, requests.size(), sessionId);
            listener.onProgress(ProgressEvent.iterationStarted(iteration, maxIterations, requests.size()));

            List<ToolExecutionRecord> iterationRecords = new ArrayList<>();
            for (ToolInvocationRequest toolRequest : requests) {
                ToolExecutionRecord record = execute(toolRequest, iteration, invoker, runCtx);
                iterationRecords.add(record);
                executed.add(toolRequest);
                listener.onProgress(ProgressEvent.toolFinished(iteration, record.toolName(), record.error()));
            }
            records.addAll(iterationRecords);

            FollowUpPromptBuilder.FollowUpPrompt followUp = followUpPromptBuilder.build(
                    IterationOutcome.of(iteration, iterationRecords), query, maxIterations);
            context.appendExchange(followUp.assistantNote(), followUp.userPrompt());

            log.info("Sending {} follow-up [sessionId={}, iteration={}]",
                    followUp.branch(), sessionId, iteration);
            current = ask(context.messages(), CompletionOptions.maxTokens(followUp.maxTokens()), runCtx);

            if (isEmpty(current) && iteration < maxIterations) {
                log.warn("Empty follow-up reply, retrying with simplified context [sessionId={}, iteration={}]",
                        sessionId, iteration);
                current = simplifiedRetry(query, iteration, runCtx);
            }
            if (isEmpty(current)) {
                log.warn("Model unavailable, ending iterations [sessionId={}, iteration={}]", sessionId, iteration);
                reason = TerminationReason.MODEL_UNAVAILABLE;
            } else if (containsSentinel(current)) {
                log.info("Model signalled completion with '{}' [sessionId={}, iteration={}]",
                        config.getSentinel(), sessionId, iteration);
                reason = TerminationReason.SENTINEL;
            } else if (iteration < maxIterations) {
                pause(config.getInterIterationDelay());
            }
        }

        return finish(request, context, records, executed, current, iteration, reason, runCtx, listener);
    }

    private ToolExecutionRecord execute(ToolInvocationRequest toolRequest,
                                        int iteration,
                                        CapabilityInvoker invoker,
                                        RunContext runCtx) {
        long start = System.currentTimeMillis();
        Map<String, Object> result = invoker.invoke(toolRequest.name(), toolRequest.arguments());
        long latency = System.currentTimeMillis() - start;

        boolean error = classifier.isError(toolRequest, result);
        runCtx.recordToolCall(toolRequest.name(), iteration, latency, error);

        if (error) {
            log.info("Tool [{}] failed in {}ms", toolRequest.name(), latency);
        } else {
            log.info("Tool [{}] succeeded in {}ms", toolRequest.name(), latency);
        }
        log.debug("Tool [{}] result: {}", toolRequest.name(), result);
        return new ToolExecutionRecord(toolRequest, result, error, iteration);
    }

    private OrchestrationResult finish(OrchestrationRequest request,
                                       ConversationContext context,
                                       List<ToolExecutionRecord> records,
                                       List<ToolInvocationRequest> executed,
                                       String current,
                                       int iterations,
                                       TerminationReason reason,
                                       RunContext runCtx,
                                       ProgressListener listener) {
        String finalAnswer;
        if (reason == TerminationReason.DIRECT_ANSWER) {
            finalAnswer = current;
        } else {
            if (!records.isEmpty()) {
                long succeeded = records.stream().filter(ToolExecutionRecord::succeeded).count();
                listener.onProgress(ProgressEvent.synthesizing((int) succeeded, records.size() - (int) succeeded));
            }
            finalAnswer = synthesizer.synthesize(context.seedMessages(), request.getQuery(), records, current, runCtx);
        }

        int failed = (int) records.stream().filter(ToolExecutionRecord::error).count();
        log.info("Orchestration complete [sessionId={}, reason={}, iterations={}, {}]",
                request.getSessionId(), reason, Math.max(iterations, 1), runCtx.summary());

        return OrchestrationResult.builder()
                .finalAnswer(finalAnswer)
                .toolCallsExecuted(executed)
                .iterationsUsed(Math.max(iterations, 1))
                .succeededToolCalls(records.size() - failed)
                .failedToolCalls(failed)
                .terminationReason(reason)
                .sessionId(request.getSessionId())
                .build();
    }

    private String ask(List<Message> messages, CompletionOptions options, RunContext runCtx) {
        LlmResponse response = llmClient.chat(messages, options);
        runCtx.recordModelCall(response);
        if (response == null || response.isEmpty()) {
            return null;
        }
        log.debug("Model reply: {}", response.getContent());
        return response.getContent();
    }

    private String simplifiedRetry(String query, int iteration, RunContext runCtx) {
        return ask(List.of(Message.user(followUpPromptBuilder.simplifiedRetry(query, iteration))),
                CompletionOptions.of(config.getSimplifiedRetryTemperature(), config.getSimplifiedRetryMaxTokens()),
                runCtx);
    }

    private boolean containsSentinel(String text) {
        return text.toUpperCase(Locale.ROOT).contains(config.getSentinel().toUpperCase(Locale.ROOT));
    }

    private static boolean isEmpty(String text) {
        return text == null || text.isBlank();
    }

    private static void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Orchestration interrupted between iterations", e);
        }
    }
}
