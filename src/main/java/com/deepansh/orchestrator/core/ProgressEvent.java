package com.deepansh.orchestrator.core;

/**
 * A state transition published by the orchestration loop while it works.
 * Only non-terminal progress travels through here; the terminal update belongs
 * to whoever owns the session.
 */
public record ProgressEvent(Type type, int iteration, String toolName, String message) {

    public enum Type {
        ITERATION_STARTED,
        TOOL_SUCCEEDED,
        TOOL_FAILED,
        SYNTHESIZING
    }

    public static ProgressEvent iterationStarted(int iteration, int maxIterations, int requestCount) {
        return new ProgressEvent(Type.ITERATION_STARTED, iteration, null,
                "Iteration %d/%d: executing %d tool(s)".formatted(iteration, maxIterations, requestCount));
    }

    public static ProgressEvent toolFinished(int iteration, String toolName, boolean error) {
        return error
                ? new ProgressEvent(Type.TOOL_FAILED, iteration, toolName, "Tool '" + toolName + "' failed")
                : new ProgressEvent(Type.TOOL_SUCCEEDED, iteration, toolName, "Tool '" + toolName + "' succeeded");
    }

    public static ProgressEvent synthesizing(int succeeded, int failed) {
        return new ProgressEvent(Type.SYNTHESIZING, 0, null,
                "Generating final answer (%d succeeded, %d failed)".formatted(succeeded, failed));
    }
}
