package com.example.workflowsynth.validation;

import java.util.Objects;

public record NodeTypeDefinition(String type, String category, String description) {
    public NodeTypeDefinition {
        Objects.requireNonNull(type, "type");
    }
}
