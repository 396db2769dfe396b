package com.example.workflowsynth.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a structural validation pass. {@code issues} holds error-severity findings only;
 * warnings never affect {@link #isValid()}.
 */
public record ValidationReport(
        List<ValidationIssue> issues,
        List<ValidationIssue> warnings,
        NodeStats nodeStats,
        CredentialStats credentialStats
) {
    public ValidationReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<ValidationIssue> issuesOfKind(IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }

    public List<ValidationIssue> warningsOfKind(IssueKind kind) {
        return warnings.stream().filter(issue -> issue.kind() == kind).toList();
    }
}
