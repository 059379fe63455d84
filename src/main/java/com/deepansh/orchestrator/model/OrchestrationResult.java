package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestrationResult {

    private String finalAnswer;

    @Builder.Default
    private List<ToolInvocationRequest> toolCallsExecuted = new ArrayList<>();

    private int iterationsUsed;
    private int succeededToolCalls;
    private int failedToolCalls;
    private TerminationReason terminationReason;
    private String sessionId;
}
