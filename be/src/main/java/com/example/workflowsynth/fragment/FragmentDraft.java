package com.example.workflowsynth.fragment;

import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed but unrepaired fragment: typed nodes, connections still in their raw shape, and the
 * generator's optional entry/exit hints.
 */
public record FragmentDraft(
        String name,
        List<WorkflowNode> nodes,
        Map<String, Object> rawConnections,
        String startNode,
        List<String> endNodes,
        List<ValidationIssue> warnings,
        List<RepairAction> actions
) {
    public FragmentDraft {
        Objects.requireNonNull(name, "name");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        rawConnections = rawConnections != null ? new LinkedHashMap<>(rawConnections) : new LinkedHashMap<>();
        endNodes = endNodes != null ? List.copyOf(endNodes) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    /** Same draft under another fragment name, recording the rename. */
    public FragmentDraft renamed(String newName, String reason) {
        List<RepairAction> renamedActions = new ArrayList<>(actions);
        renamedActions.add(RepairAction.note(RepairAction.Kind.RENAMED, newName, reason));
        return new FragmentDraft(newName, nodes, rawConnections, startNode, endNodes, warnings, renamedActions);
    }

    public static FragmentDraft empty(String name, ValidationIssue warning) {
        return new FragmentDraft(name, List.of(), Map.of(), null, List.of(),
                warning != null ? List.of(warning) : List.of(), List.of());
    }
}
