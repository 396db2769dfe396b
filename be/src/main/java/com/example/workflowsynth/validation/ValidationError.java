package com.example.workflowsynth.validation;

import java.util.Objects;

/**
 * A request-level field error, e.g. a blank prompt or a fragment without a name.
 * Graph findings use {@link ValidationIssue} instead.
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
