package com.example.workflowsynth.fragment;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks a fragment's entry node and exit nodes from its connections.
 */
public final class EntryExitInference {

    private EntryExitInference() {
    }

    /**
     * The leftmost node without incoming edges; equal x resolves to array order. When every node has an incoming
     * edge (a cycle), the first node.
     */
    public static Optional<String> inferEntry(List<WorkflowNode> nodes, ConnectionMap connections) {
        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        Set<String> withIncoming = connections.targetNames();
        WorkflowNode entry = null;
        for (WorkflowNode node : nodes) {
            if (withIncoming.contains(node.name())) {
                continue;
            }
            if (entry == null || node.position().x() < entry.position().x()) {
                entry = node;
            }
        }
        return Optional.of(entry != null ? entry.name() : nodes.get(0).name());
    }

    /**
     * Nodes without outgoing edges, in array order. When there are none, the rightmost node stands in as a
     * synthetic exit even though it has an outgoing edge.
     */
    public static List<String> inferExits(List<WorkflowNode> nodes, ConnectionMap connections) {
        List<String> exits = new ArrayList<>();
        for (WorkflowNode node : nodes) {
            if (!connections.hasOutgoing(node.name())) {
                exits.add(node.name());
            }
        }
        if (exits.isEmpty() && !nodes.isEmpty()) {
            WorkflowNode rightmost = nodes.get(0);
            for (WorkflowNode node : nodes) {
                if (node.position().x() > rightmost.position().x()) {
                    rightmost = node;
                }
            }
            exits.add(rightmost.name());
        }
        return exits;
    }
}
