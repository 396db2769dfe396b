package com.example.workflowsynth.synthesis;

import java.util.Objects;

/**
 * One branch of a plan; each branch becomes one generated fragment.
 */
public record BranchPlan(String name, String description, String triggerCondition, boolean parallel, int estimatedNodes) {

    public BranchPlan {
        Objects.requireNonNull(name, "name");
        description = description != null ? description : "";
        estimatedNodes = Math.max(estimatedNodes, 0);
    }
}
