package com.example.workflowsynth.domain;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when an assembled graph breaks an invariant the engine itself is responsible for
 * (e.g. duplicate node names after collision handling). Not used for untrusted-input problems,
 * which are reported as validation issues instead.
 */
@Getter
public class GraphInvariantViolationException extends RuntimeException {

    private final List<String> offendingNames;

    public GraphInvariantViolationException(String message, List<String> offendingNames) {
        super(message + ": " + offendingNames);
        this.offendingNames = offendingNames != null ? List.copyOf(offendingNames) : List.of();
    }
}
