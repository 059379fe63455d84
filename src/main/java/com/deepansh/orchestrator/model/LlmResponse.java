package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Model text. Null or blank when the call produced nothing usable. */
    private String content;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean isEmpty() {
        return content == null || content.isBlank();
    }

    public static LlmResponse empty() {
        return LlmResponse.builder().build();
    }

    public static LlmResponse of(String content) {
        return LlmResponse.builder().content(content).build();
    }
}
