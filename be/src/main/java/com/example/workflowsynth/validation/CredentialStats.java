package com.example.workflowsynth.validation;

import java.util.List;

public record CredentialStats(List<String> required, List<String> duplicates) {
    public CredentialStats {
        required = required != null ? List.copyOf(required) : List.of();
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }
}
