package com.example.workflowsynth.fragment;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Ports;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.normalize.ConnectionNormalizer;
import com.example.workflowsynth.repair.Attachment;
import com.example.workflowsynth.repair.ReattachmentRules;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.repair.RepairScope;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repairs a single fragment so it can be assembled: completes parameters, prefixes ids, chains
 * unconnected fragments linearly, reattaches orphans and infers the entry and exit nodes.
 */
@Slf4j
public class FragmentRepairer {

    public RepairedFragment repair(FragmentDraft draft) {
        String prefix = FragmentPrefixes.of(draft.name());
        List<RepairAction> actions = new ArrayList<>(draft.actions());
        if (draft.nodes().isEmpty()) {
            return new RepairedFragment(draft.name(), prefix, List.of(), ConnectionMap.empty(), null,
                    List.of(), List.of(), actions, draft.warnings());
        }

        List<WorkflowNode> nodes = normalizeIdentity(draft.nodes(), prefix, actions);
        ConnectionMap connections = ConnectionNormalizer.normalize(draft.rawConnections());

        if (nodes.size() >= 2 && connections.isEmpty()) {
            chainLinearly(nodes, connections, actions);
        }

        Set<String> connected = new LinkedHashSet<>(connections.sourcesWithTargets());
        connected.addAll(connections.targetNames());
        List<String> unresolved = reattachOrphans(draft.name(), nodes, connections, connected, actions);

        String entry = resolveEntry(draft.startNode(), nodes, connections);
        List<String> exits = resolveExits(draft.endNodes(), nodes, connections);
        log.debug("Repaired fragment={} nodes={} entry={} exits={} unresolved={}",
                draft.name(), nodes.size(), entry, exits, unresolved);
        return new RepairedFragment(draft.name(), prefix, nodes, connections, entry, exits, unresolved,
                actions, draft.warnings());
    }

    /**
     * Completes parameters, prefixes ids with {@code prefix_} and renames later duplicate names
     * {@code "<name> (2)"}, {@code "<name> (3)"}... References keep pointing at the first holder of a name.
     */
    private List<WorkflowNode> normalizeIdentity(List<WorkflowNode> draftNodes, String prefix, List<RepairAction> actions) {
        List<WorkflowNode> nodes = new ArrayList<>(draftNodes.size());
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        String idPrefix = prefix + "_";
        for (int i = 0; i < draftNodes.size(); i++) {
            WorkflowNode node = ParameterDefaults.apply(draftNodes.get(i));
            String id = node.id().startsWith(idPrefix) ? node.id() : idPrefix + node.id();
            if (!ids.add(id)) {
                id = id + "_" + (i + 1);
                ids.add(id);
            }
            String name = node.name();
            if (!names.add(name)) {
                int suffix = 2;
                while (names.contains(name + " (" + suffix + ")")) {
                    suffix++;
                }
                String renamed = name + " (" + suffix + ")";
                names.add(renamed);
                actions.add(RepairAction.note(RepairAction.Kind.RENAMED, renamed, "duplicate name \"" + name + "\""));
                name = renamed;
            }
            nodes.add(node.withId(id).withName(name));
        }
        return nodes;
    }

    /** node1 -> node2 -> ... in array order; trigger-type nodes never receive an edge. */
    private void chainLinearly(List<WorkflowNode> nodes, ConnectionMap connections, List<RepairAction> actions) {
        WorkflowNode previous = null;
        for (WorkflowNode node : nodes) {
            if (previous != null && !NodeTypes.isTrigger(node)) {
                connections.add(previous.name(), Ports.SUCCESS, TargetReference.main(node.name()));
                actions.add(RepairAction.edge(RepairAction.Kind.LINEAR_CHAIN, previous.name(), Ports.SUCCESS,
                        node.name(), "fragment had no connections"));
            }
            previous = node;
        }
    }

    private List<String> reattachOrphans(String fragmentName, List<WorkflowNode> nodes, ConnectionMap connections,
                                         Set<String> connected, List<RepairAction> actions) {
        List<WorkflowNode> orphans = new ArrayList<>();
        for (WorkflowNode node : nodes) {
            if (!connected.contains(node.name()) && !NodeTypes.isTrigger(node)) {
                orphans.add(node);
            }
        }
        if (orphans.isEmpty()) {
            return List.of();
        }
        log.debug("Fragment={} has {} orphan(s): {}", fragmentName, orphans.size(),
                orphans.stream().map(WorkflowNode::name).toList());
        orphans.sort(Comparator.comparingDouble(n -> n.position().x() + n.position().y()));

        RepairScope scope = new RepairScope(nodes, connections, connected, null);
        List<String> unresolved = new ArrayList<>();
        for (WorkflowNode orphan : orphans) {
            Optional<ReattachmentRules.Match> match = ReattachmentRules.firstMatch(ReattachmentRules.FRAGMENT, orphan, scope);
            if (match.isEmpty()) {
                unresolved.add(orphan.name());
                actions.add(RepairAction.note(RepairAction.Kind.UNRESOLVED_ORPHAN, orphan.name(),
                        "no reattachment rule matched in fragment " + fragmentName));
                continue;
            }
            for (Attachment attachment : match.get().attachments()) {
                scope.apply(attachment);
                actions.add(RepairAction.edge(RepairAction.Kind.REATTACHED, attachment.source(), attachment.port(),
                        attachment.target(), match.get().rule().name()));
                log.debug("Reattached {} -> {} port={} rule={}", attachment.source(), attachment.target(),
                        attachment.port(), match.get().rule().name());
            }
        }
        return unresolved;
    }

    private String resolveEntry(String hint, List<WorkflowNode> nodes, ConnectionMap connections) {
        if (hint != null && nodes.stream().anyMatch(n -> n.name().equals(hint))) {
            return hint;
        }
        return EntryExitInference.inferEntry(nodes, connections).orElseThrow();
    }

    private List<String> resolveExits(List<String> hints, List<WorkflowNode> nodes, ConnectionMap connections) {
        Set<String> names = new HashSet<>();
        nodes.forEach(n -> names.add(n.name()));
        List<String> exits = hints.stream().filter(names::contains).distinct().toList();
        return !exits.isEmpty() ? exits : EntryExitInference.inferExits(nodes, connections);
    }
}
