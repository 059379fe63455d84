package com.deepansh.orchestrator.core;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword fallback used only when the classification model call returns nothing.
 * Pure function of the result's string form.
 */
@Component
public class HeuristicResultClassifier {

    static final List<String> ERROR_INDICATORS = List.of(
            "error", "missing", "not found", "denied", "forbidden", "invalid", "failed", "unable");

    public boolean isError(Map<String, Object> result) {
        String text = String.valueOf(result).toLowerCase(Locale.ROOT);
        return ERROR_INDICATORS.stream().anyMatch(text::contains);
    }
}
