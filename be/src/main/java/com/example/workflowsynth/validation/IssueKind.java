package com.example.workflowsynth.validation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue categories reported by the validator and by the synthesis pipeline.
 */
public enum IssueKind {
    INVALID_NODE_TYPE("invalid_node_type"),
    DISCONNECTED_NODE("disconnected_node"),
    INVALID_CONNECTION("invalid_connection"),
    DUPLICATE_NODE_NAME("duplicate_node_name"),
    DUPLICATE_CREDENTIAL("duplicate_credential"),
    EXCESSIVE_NODE_TYPE("excessive_node_type"),
    MISSING_ERROR_HANDLING("missing_error_handling"),
    BRANCHING_WITHOUT_MERGE("branching_without_merge"),
    MALFORMED_FRAGMENT("malformed_fragment"),
    MALFORMED_NODE("malformed_node"),
    EMPTY_FRAGMENT("empty_fragment"),
    GENERATION_FAILED("generation_failed"),
    UNKNOWN_MERGE_SOURCE("unknown_merge_source");

    private final String value;

    IssueKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
