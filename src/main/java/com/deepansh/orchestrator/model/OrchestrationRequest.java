package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class OrchestrationRequest {

    private String sessionId;
    private String query;
    private String callbackUrl;
    private String userRole;

    @Builder.Default
    private List<Message> history = new ArrayList<>();
}
