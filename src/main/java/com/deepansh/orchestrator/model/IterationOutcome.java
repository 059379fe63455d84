package com.deepansh.orchestrator.model;

import java.util.List;

/**
 * Succeeded/failed split of one iteration's records.
 * Only used to pick the follow-up prompt; never stored.
 */
public record IterationOutcome(int iteration,
                               List<ToolExecutionRecord> succeeded,
                               List<ToolExecutionRecord> failed) {

    public static IterationOutcome of(int iteration, List<ToolExecutionRecord> records) {
        return new IterationOutcome(
                iteration,
                records.stream().filter(ToolExecutionRecord::succeeded).toList(),
                records.stream().filter(ToolExecutionRecord::error).toList());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public boolean hasSuccesses() {
        return !succeeded.isEmpty();
    }

    public int size() {
        return succeeded.size() + failed.size();
    }
}
