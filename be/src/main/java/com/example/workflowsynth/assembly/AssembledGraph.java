package com.example.workflowsynth.assembly;

import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.ValidationIssue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of {@link GraphAssembler}: the unified graph plus what the global repair pass needs to know about it.
 *
 * @param fragmentByNode fragment name per node name; synthetic trigger and merge nodes are absent
 */
public record AssembledGraph(
        WorkflowGraph graph,
        String triggerName,
        Map<String, String> fragmentByNode,
        List<FragmentPlacement> placements,
        List<MergeBinding> mergeBindings,
        List<RepairAction> actions,
        List<ValidationIssue> warnings
) {
    public AssembledGraph {
        Objects.requireNonNull(graph, "graph");
        fragmentByNode = fragmentByNode != null ? Map.copyOf(fragmentByNode) : Map.of();
        placements = placements != null ? List.copyOf(placements) : List.of();
        mergeBindings = mergeBindings != null ? List.copyOf(mergeBindings) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Optional<FragmentPlacement> placement(String fragmentName) {
        return placements.stream().filter(p -> p.name().equals(fragmentName)).findFirst();
    }

    /** Entry nodes the trigger fans out to, in fragment order. */
    public List<String> entryNodes() {
        return placements.stream().map(FragmentPlacement::entry).toList();
    }
}
