package com.example.workflowsynth.domain;

import java.util.Objects;

/**
 * Destination of an edge: the target node's name, its input port kind and its input slot.
 * Field names follow the wire format ({@code node}, {@code type}, {@code index}).
 */
public record TargetReference(String node, String type, int index) {

    public static final String MAIN_INPUT = "main";

    public TargetReference {
        Objects.requireNonNull(node, "node");
        type = type != null && !type.isBlank() ? type : MAIN_INPUT;
    }

    public static TargetReference main(String node) {
        return new TargetReference(node, MAIN_INPUT, 0);
    }

    public TargetReference withNode(String newNode) {
        return new TargetReference(newNode, type, index);
    }
}
