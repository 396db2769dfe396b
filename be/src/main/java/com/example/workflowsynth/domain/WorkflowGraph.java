package com.example.workflowsynth.domain;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An automation graph: nodes, the connection map keyed by node name, and workflow settings.
 */
public record WorkflowGraph(
        String name,
        List<WorkflowNode> nodes,
        ConnectionMap connections,
        Map<String, Object> settings
) {
    public WorkflowGraph {
        Objects.requireNonNull(name, "name");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        connections = connections != null ? connections : ConnectionMap.empty();
        settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
    }

    public Optional<WorkflowNode> node(String nodeName) {
        return nodes.stream().filter(n -> n.name().equals(nodeName)).findFirst();
    }

    public Set<String> nodeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (WorkflowNode node : nodes) {
            names.add(node.name());
        }
        return names;
    }

    public WorkflowGraph withConnections(ConnectionMap newConnections) {
        return new WorkflowGraph(name, nodes, newConnections, settings);
    }
}
