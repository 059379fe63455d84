package com.deepansh.orchestrator.llm;

/**
 * Per-call overrides. A null field means "use the provider default from application.yml".
 */
public record CompletionOptions(Double temperature, Integer maxTokens) {

    private static final CompletionOptions DEFAULTS = new CompletionOptions(null, null);

    public static CompletionOptions defaults() {
        return DEFAULTS;
    }

    public static CompletionOptions of(double temperature, int maxTokens) {
        return new CompletionOptions(temperature, maxTokens);
    }

    public static CompletionOptions maxTokens(int maxTokens) {
        return new CompletionOptions(null, maxTokens);
    }
}
