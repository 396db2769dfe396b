package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Forward reachability over the connection map.
 */
public final class GraphReachability {

    private GraphReachability() {
    }

    /**
     * Roots of a graph: every trigger-type node, or, when there is none, every node without incoming edges.
     */
    public static Set<String> roots(WorkflowGraph graph) {
        Set<String> roots = new LinkedHashSet<>();
        for (WorkflowNode node : graph.nodes()) {
            if (NodeTypes.isTrigger(node)) {
                roots.add(node.name());
            }
        }
        if (roots.isEmpty()) {
            Set<String> withIncoming = graph.connections().targetNames();
            for (WorkflowNode node : graph.nodes()) {
                if (!withIncoming.contains(node.name())) {
                    roots.add(node.name());
                }
            }
        }
        return roots;
    }

    /**
     * Breadth-first search from {@code roots}. Only names in {@code known} are visited, so dangling references
     * never count as reachable.
     */
    public static Set<String> reachableFrom(Collection<String> roots, ConnectionMap connections, Set<String> known) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            if (known.contains(root) && visited.add(root)) {
                queue.add(root);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (List<TargetReference> group : connections.ports(current)) {
                for (TargetReference target : group) {
                    if (known.contains(target.node()) && visited.add(target.node())) {
                        queue.add(target.node());
                    }
                }
            }
        }
        return visited;
    }

    public static Set<String> reachable(WorkflowGraph graph) {
        return reachableFrom(roots(graph), graph.connections(), graph.nodeNames());
    }
}
