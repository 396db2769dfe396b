package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.validation.ValidationIssue;

import java.util.List;
import java.util.Objects;

/**
 * The graph after the global pass, with the nodes that are still unreachable. Those nodes are kept in the graph.
 */
public record GlobalRepairResult(
        WorkflowGraph graph,
        List<String> unresolvedOrphans,
        List<RepairAction> actions,
        List<ValidationIssue> warnings
) {
    public GlobalRepairResult {
        Objects.requireNonNull(graph, "graph");
        unresolvedOrphans = unresolvedOrphans != null ? List.copyOf(unresolvedOrphans) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
