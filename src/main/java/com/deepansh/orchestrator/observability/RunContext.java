package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.model.LlmResponse;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-run context for collecting observability data.
 * Created at the start of each orchestration run, populated throughout,
 * then summarised in one log line at the end.
 *
 * Kept separate from ConversationContext (which holds conversation state)
 * so observability concerns don't bleed into the prompts.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int modelCalls;
    private int emptyModelReplies;

    // Token usage, taken from the "usage" block of each completion
    private int promptTokens;
    private int completionTokens;

    public void recordModelCall(LlmResponse response) {
        modelCalls++;
        if (response == null || response.isEmpty()) {
            emptyModelReplies++;
            return;
        }
        addTokens(response.getPromptTokens(), response.getCompletionTokens());
    }

    public void recordToolCall(String toolName, int iteration, long latencyMs, boolean error) {
        toolCallRecords.add(new ToolCallRecord(toolName, iteration, latencyMs, error));
    }

    public void addTokens(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public long failedToolCalls() {
        return toolCallRecords.stream().filter(ToolCallRecord::error).count();
    }

    public String summary() {
        return "modelCalls=%d, emptyReplies=%d, toolCalls=%d, failedToolCalls=%d, tokens=%d, latency=%dms"
                .formatted(modelCalls, emptyModelReplies, toolCallRecords.size(), failedToolCalls(),
                        totalTokens(), elapsedMs());
    }

    public record ToolCallRecord(
            String toolName,
            int iteration,
            long latencyMs,
            boolean error
    ) {}
}
