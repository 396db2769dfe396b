package com.example.workflowsynth.fragment;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.ValidationIssue;

import java.util.List;
import java.util.Objects;

/**
 * A fragment after local repair: the unit the assembler combines. {@code entry} is null only for an empty
 * fragment.
 */
public record RepairedFragment(
        String name,
        String prefix,
        List<WorkflowNode> nodes,
        ConnectionMap connections,
        String entry,
        List<String> exits,
        List<String> unresolvedOrphans,
        List<RepairAction> actions,
        List<ValidationIssue> warnings
) {
    public RepairedFragment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(prefix, "prefix");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        connections = connections != null ? connections : ConnectionMap.empty();
        exits = exits != null ? List.copyOf(exits) : List.of();
        unresolvedOrphans = unresolvedOrphans != null ? List.copyOf(unresolvedOrphans) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
