package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.MergePoint;

import java.util.List;
import java.util.Objects;

/**
 * Breakdown of a request into a main trigger, independently generated branches and the points where
 * branches merge again. Merge points name branches, which are the fragments of the assembled graph.
 */
public record WorkflowPlan(
        TriggerPlan mainTrigger,
        List<BranchPlan> branches,
        List<MergePoint> mergePoints
) {
    public WorkflowPlan {
        Objects.requireNonNull(mainTrigger, "mainTrigger");
        branches = branches != null ? List.copyOf(branches) : List.of();
        mergePoints = mergePoints != null ? List.copyOf(mergePoints) : List.of();
    }
}
