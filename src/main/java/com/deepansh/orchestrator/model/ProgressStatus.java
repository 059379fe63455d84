package com.deepansh.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressStatus {
    PROCESSING("processing"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireValue;

    ProgressStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
