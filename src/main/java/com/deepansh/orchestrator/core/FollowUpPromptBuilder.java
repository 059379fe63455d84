package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.model.IterationOutcome;
import com.deepansh.orchestrator.model.ToolExecutionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks and fills the follow-up sent after each iteration.
 *
 * | Outcome                            | Branch         | Reply budget |
 * |------------------------------------|----------------|--------------|
 * | failures and budget left           | CORRECTIVE     | 700 tokens   |
 * | everything succeeded (or mixed on  | ALL_SUCCEEDED  | 500 tokens   |
 * | the last iteration)                |                |              |
 * | nothing succeeded                  | ALL_FAILED     | 600 tokens   |
 */
@Component
public class FollowUpPromptBuilder {

    public enum Branch {
        CORRECTIVE,
        ALL_SUCCEEDED,
        ALL_FAILED
    }

    public record FollowUpPrompt(Branch branch, String assistantNote, String userPrompt, int maxTokens) {}

    private static final String CORRECTIVE_TEMPLATE = """
            ERRORS DETECTED:
            %s
            %s
            Original question: %s

            The errors above were identified automatically. Analyze each specific error and:
            1. If a required parameter is missing (for example "missing required parameter: path"), add it
            2. If the call has a format or syntax problem, fix the structure of the call
            3. If it is a permission or access error, try an alternative tool
            4. If an identifier (repository, user, resource name) is wrong or not found, verify the correct one
            5. If it is an API error, try a more specific query

            IMPORTANT:
            - Learn from each specific error and correct it
            - Use the JSON format for new tool requests
            - Do not repeat the exact same failing call
            - If you already have enough successful information, reply "%s"

            Which tool will you use to fix these specific errors, or can you answer already?""";

    private static final String ALL_SUCCEEDED_TEMPLATE = """
            Results: executed %d tool(s): %s

            Original question: %s

            Do you need to execute more specific tools, or can you answer already?
            If you need another tool, request it with the JSON format.
            If you already have enough, reply "%s".""";

    private static final String ALL_FAILED_TEMPLATE = """
            All tools failed:
            %s

            Original question: %s

            All of the previous tools failed. Please:
            1. Analyze the errors and find a different strategy
            2. Use alternative tools or different parameters
            3. If you can give a partial answer from general knowledge, reply "%s"

            Which alternative tool will you try?""";

    private static final String SIMPLIFIED_RETRY_TEMPLATE = """
            Original question: %s

            %s Do you need more specific tools (JSON format) or can you reply "%s"?""";

    private final ObjectMapper objectMapper;
    private final OrchestratorProperties.Loop config;

    public FollowUpPromptBuilder(ObjectMapper objectMapper, OrchestratorProperties properties) {
        this.objectMapper = objectMapper;
        this.config = properties.getLoop();
    }

    public FollowUpPrompt build(IterationOutcome outcome, String originalQuestion, int maxIterations) {
        int iteration = outcome.iteration();
        String sentinel = config.getSentinel();

        if (outcome.hasFailures() && iteration < maxIterations) {
            String errors = outcome.failed().stream()
                    .map(r -> "- Error in '%s' with arguments %s: %s".formatted(
                            r.toolName(), toJson(r.request().arguments()), toJson(r.rawResult())))
                    .collect(Collectors.joining("\n"));
            String successes = outcome.hasSuccesses()
                    ? "Successful tools: " + toolNames(outcome.succeeded()) + "\n"
                    : "";
            return new FollowUpPrompt(Branch.CORRECTIVE,
                    "I executed the tools of iteration %d but found some errors.".formatted(iteration),
                    CORRECTIVE_TEMPLATE.formatted(errors, successes, originalQuestion, sentinel),
                    config.getCorrectiveMaxTokens());
        }

        if (outcome.hasSuccesses()) {
            List<ToolExecutionRecord> all = new ArrayList<>(outcome.succeeded());
            all.addAll(outcome.failed());
            return new FollowUpPrompt(Branch.ALL_SUCCEEDED,
                    "I executed the tools of iteration %d.".formatted(iteration),
                    ALL_SUCCEEDED_TEMPLATE.formatted(outcome.size(), toolNames(all), originalQuestion, sentinel),
                    config.getAllSucceededMaxTokens());
        }

        String failures = outcome.failed().stream()
                .map(r -> "- %s: %s".formatted(r.toolName(), toJson(r.rawResult())))
                .collect(Collectors.joining("\n"));
        return new FollowUpPrompt(Branch.ALL_FAILED,
                "Every tool of iteration %d failed.".formatted(iteration),
                ALL_FAILED_TEMPLATE.formatted(failures, originalQuestion, sentinel),
                config.getAllFailedMaxTokens());
    }

    /**
     * Single-message prompt used when the model returned nothing; carries no history.
     */
    public String simplifiedRetry(String originalQuestion, int iteration) {
        String status = iteration > 0
                ? "Iteration %d completed.".formatted(iteration)
                : "No tools have been executed yet.";
        return SIMPLIFIED_RETRY_TEMPLATE.formatted(originalQuestion, status, config.getSentinel());
    }

    private static String toolNames(List<ToolExecutionRecord> records) {
        return records.stream().map(ToolExecutionRecord::toolName).collect(Collectors.joining(", "));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
