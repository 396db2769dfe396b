package com.example.workflowsynth.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
