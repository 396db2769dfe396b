package com.example.workflowsynth.assembly;

import java.util.List;
import java.util.Objects;

/**
 * A merge node placed by the assembler, still to be wired against its contributing fragments.
 */
public record MergeBinding(String mergeNode, List<String> fragments) {

    public MergeBinding {
        Objects.requireNonNull(mergeNode, "mergeNode");
        fragments = fragments != null ? List.copyOf(fragments) : List.of();
    }
}
