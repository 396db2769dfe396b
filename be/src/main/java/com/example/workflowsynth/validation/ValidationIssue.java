package com.example.workflowsynth.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One finding about a graph or a fragment. {@code nodeId}/{@code nodeName} name the node the finding is
 * about, or a pseudo reference such as {@code "workflow"} or {@code "pattern"} for graph-wide findings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
        String nodeId,
        String nodeName,
        IssueKind kind,
        Severity severity,
        String message,
        String suggestion
) {
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationIssue error(String nodeId, String nodeName, IssueKind kind, String message, String suggestion) {
        return new ValidationIssue(nodeId, nodeName, kind, Severity.ERROR, message, suggestion);
    }

    public static ValidationIssue warning(String nodeId, String nodeName, IssueKind kind, String message, String suggestion) {
        return new ValidationIssue(nodeId, nodeName, kind, Severity.WARNING, message, suggestion);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
