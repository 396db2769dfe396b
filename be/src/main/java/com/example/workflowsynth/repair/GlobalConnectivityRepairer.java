package com.example.workflowsynth.repair;

import com.example.workflowsynth.assembly.AssembledGraph;
import com.example.workflowsynth.assembly.FragmentPlacement;
import com.example.workflowsynth.assembly.MergeBinding;
import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.Edge;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Ports;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.validation.IssueKind;
import com.example.workflowsynth.validation.ValidationIssue;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Single pass over an assembled graph: wires merge nodes, drops edges into triggers and reattaches every node
 * the triggers cannot reach. Nodes are never removed; what stays unreachable is returned as unresolved.
 */
@Slf4j
public class GlobalConnectivityRepairer {

    public GlobalRepairResult repair(AssembledGraph assembled) {
        WorkflowGraph graph = assembled.graph();
        ConnectionMap connections = graph.connections().copy();
        List<RepairAction> actions = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        wireMergeNodes(assembled, connections, actions, warnings);
        removeEdgesIntoTriggers(graph.nodes(), connections, actions);

        WorkflowGraph working = graph.withConnections(connections);
        Set<String> roots = GraphReachability.roots(working);
        Set<String> known = working.nodeNames();
        Set<String> reachable = GraphReachability.reachableFrom(roots, connections, known);
        RepairScope scope = new RepairScope(working.nodes(), connections, reachable, assembled.fragmentByNode());

        boolean progress = true;
        while (progress) {
            progress = false;
            for (WorkflowNode node : working.nodes()) {
                if (reachable.contains(node.name()) || NodeTypes.isTrigger(node)) {
                    continue;
                }
                Optional<ReattachmentRules.Match> match = ReattachmentRules.firstMatch(ReattachmentRules.GLOBAL, node, scope);
                if (match.isEmpty()) {
                    continue;
                }
                for (Attachment attachment : match.get().attachments()) {
                    scope.apply(attachment);
                    actions.add(RepairAction.edge(RepairAction.Kind.REATTACHED, attachment.source(), attachment.port(),
                            attachment.target(), match.get().rule().name()));
                    log.debug("Reattached {} -> {} port={} rule={}", attachment.source(), attachment.target(),
                            attachment.port(), match.get().rule().name());
                }
                reachable = GraphReachability.reachableFrom(roots, connections, known);
                scope.resetAttached(reachable);
                progress = true;
            }
        }

        List<String> unresolved = new ArrayList<>();
        for (WorkflowNode node : working.nodes()) {
            if (!reachable.contains(node.name()) && !NodeTypes.isTrigger(node)) {
                unresolved.add(node.name());
                actions.add(RepairAction.note(RepairAction.Kind.UNRESOLVED_ORPHAN, node.name(),
                        "not reachable from any trigger"));
            }
        }
        if (!unresolved.isEmpty()) {
            log.info("Global repair left {} unreachable node(s): {}", unresolved.size(), unresolved);
        }
        return new GlobalRepairResult(working, unresolved, actions, warnings);
    }

    /**
     * Each contributing fragment's exits feed the merge node on their own input slot, in declaration order.
     */
    private void wireMergeNodes(AssembledGraph assembled, ConnectionMap connections, List<RepairAction> actions,
                                List<ValidationIssue> warnings) {
        for (MergeBinding binding : assembled.mergeBindings()) {
            int input = 0;
            for (String fragmentName : binding.fragments()) {
                Optional<FragmentPlacement> placement = assembled.placement(fragmentName);
                if (placement.isEmpty()) {
                    log.warn("Merge node references unknown fragment merge={} fragment={}", binding.mergeNode(), fragmentName);
                    warnings.add(ValidationIssue.warning(null, binding.mergeNode(), IssueKind.UNKNOWN_MERGE_SOURCE,
                            "Merge node \"" + binding.mergeNode() + "\" references unknown or skipped fragment \""
                                    + fragmentName + "\"",
                            "Check the merge point declaration"));
                    continue;
                }
                for (String exit : placement.get().exits()) {
                    if (exit.equals(binding.mergeNode())) {
                        continue;
                    }
                    connections.add(exit, Ports.SUCCESS, new TargetReference(binding.mergeNode(), TargetReference.MAIN_INPUT, input));
                    actions.add(RepairAction.edge(RepairAction.Kind.MERGE_WIRED, exit, Ports.SUCCESS, binding.mergeNode(),
                            "exit of fragment " + fragmentName));
                }
                input++;
            }
        }
    }

    private void removeEdgesIntoTriggers(List<WorkflowNode> nodes, ConnectionMap connections, List<RepairAction> actions) {
        for (WorkflowNode node : nodes) {
            if (!NodeTypes.isTrigger(node)) {
                continue;
            }
            for (Edge edge : connections.removeTargetsTo(node.name())) {
                actions.add(RepairAction.edge(RepairAction.Kind.TRIGGER_EDGE_REMOVED, edge.source(), edge.port(),
                        node.name(), "trigger nodes have no incoming edges"));
                log.debug("Removed edge into trigger source={} trigger={}", edge.source(), node.name());
            }
        }
    }
}
