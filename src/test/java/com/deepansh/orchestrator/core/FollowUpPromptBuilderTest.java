package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.FollowUpPromptBuilder.Branch;
import com.deepansh.orchestrator.core.FollowUpPromptBuilder.FollowUpPrompt;
import com.deepansh.orchestrator.model.IterationOutcome;
import com.deepansh.orchestrator.model.ToolExecutionRecord;
import com.deepansh.orchestrator.model.ToolInvocationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FollowUpPromptBuilderTest {

    private final FollowUpPromptBuilder builder =
            new FollowUpPromptBuilder(new ObjectMapper(), new OrchestratorProperties());

    private static ToolExecutionRecord success(String tool, int iteration) {
        return new ToolExecutionRecord(ToolInvocationRequest.of(tool, Map.of("query", "spring")),
                Map.of("items", List.of("a", "b", "c")), false, iteration);
    }

    private static ToolExecutionRecord failure(String tool, int iteration) {
        return new ToolExecutionRecord(ToolInvocationRequest.of(tool, Map.of("owner", "octo")),
                Map.of("error", "missing required parameter: path"), true, iteration);
    }

    @Test
    void build_failuresWithBudgetLeft_returnsCorrectivePrompt() {
        IterationOutcome outcome = IterationOutcome.of(2,
                List.of(success("search_repositories", 2), failure("get_file_contents", 2)));

        FollowUpPrompt prompt = builder.build(outcome, "What is in octo's repo?", 10);

        assertThat(prompt.branch()).isEqualTo(Branch.CORRECTIVE);
        assertThat(prompt.maxTokens()).isEqualTo(700);
        assertThat(prompt.userPrompt())
                .contains("get_file_contents")
                .contains("{\"owner\":\"octo\"}")
                .contains("missing required parameter: path")
                .contains("Successful tools: search_repositories")
                .contains("Do not repeat the exact same failing call")
                .contains("\"LISTO\"")
                .contains("What is in octo's repo?");
        assertThat(prompt.assistantNote()).contains("iteration 2");
    }

    @Test
    void build_allSucceeded_returnsLighterPrompt() {
        IterationOutcome outcome = IterationOutcome.of(1,
                List.of(success("search_repositories", 1), success("list_issues", 1)));

        FollowUpPrompt prompt = builder.build(outcome, "q", 10);

        assertThat(prompt.branch()).isEqualTo(Branch.ALL_SUCCEEDED);
        assertThat(prompt.maxTokens()).isEqualTo(500);
        assertThat(prompt.userPrompt())
                .contains("executed 2 tool(s): search_repositories, list_issues")
                .contains("\"LISTO\"");
    }

    @Test
    void build_nothingSucceeded_returnsAlternativeStrategyPrompt() {
        IterationOutcome outcome = IterationOutcome.of(10, List.of(failure("get_file_contents", 10)));

        FollowUpPrompt prompt = builder.build(outcome, "q", 10);

        assertThat(prompt.branch()).isEqualTo(Branch.ALL_FAILED);
        assertThat(prompt.maxTokens()).isEqualTo(600);
        assertThat(prompt.userPrompt())
                .contains("All tools failed")
                .contains("- get_file_contents: {\"error\":\"missing required parameter: path\"}")
                .contains("different strategy");
    }

    @Test
    void build_mixedOnLastIteration_doesNotAskForCorrection() {
        IterationOutcome outcome = IterationOutcome.of(10,
                List.of(success("search_repositories", 10), failure("get_file_contents", 10)));

        FollowUpPrompt prompt = builder.build(outcome, "q", 10);

        assertThat(prompt.branch()).isEqualTo(Branch.ALL_SUCCEEDED);
    }

    @Test
    void simplifiedRetry_mentionsIterationAndSentinel() {
        assertThat(builder.simplifiedRetry("Find the repo", 3))
                .contains("Original question: Find the repo")
                .contains("Iteration 3 completed.")
                .contains("\"LISTO\"");
        assertThat(builder.simplifiedRetry("Find the repo", 0)).contains("No tools have been executed yet.");
    }
}
