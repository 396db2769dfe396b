package com.example.workflowsynth.codec;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.normalize.ConnectionNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link WorkflowGraph} and the output-boundary JSON shape
 * {@code {name, nodes, connections, settings}}.
 * <p>
 * Connections are always written in the two-level canonical form and never inline on nodes.
 * </p>
 */
public final class WorkflowJsonCodec {

    public static final String DEFAULT_NAME = "Untitled Workflow";

    private WorkflowJsonCodec() {
    }

    public static Map<String, Object> toJson(WorkflowGraph graph) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("name", graph.name());
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            nodes.add(nodeToJson(node));
        }
        json.put("nodes", nodes);
        json.put("connections", connectionsToJson(graph.connections()));
        json.put("settings", new LinkedHashMap<>(graph.settings()));
        return json;
    }

    public static Map<String, Object> nodeToJson(WorkflowNode node) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", node.id());
        json.put("name", node.name());
        json.put("type", node.type());
        json.put("typeVersion", node.typeVersion());
        json.put("position", List.of(node.position().x(), node.position().y()));
        json.put("parameters", new LinkedHashMap<>(node.parameters()));
        if (!node.credentials().isEmpty()) {
            json.put("credentials", new LinkedHashMap<>(node.credentials()));
        }
        return json;
    }

    public static Map<String, Object> connectionsToJson(ConnectionMap connections) {
        Map<String, Object> json = new LinkedHashMap<>();
        for (String source : connections.sources()) {
            List<List<TargetReference>> ports = connections.ports(source);
            List<List<Map<String, Object>>> main = new ArrayList<>();
            for (List<TargetReference> group : ports) {
                List<Map<String, Object>> targets = new ArrayList<>();
                for (TargetReference target : group) {
                    Map<String, Object> ref = new LinkedHashMap<>();
                    ref.put("node", target.node());
                    ref.put("type", target.type());
                    ref.put("index", target.index());
                    targets.add(ref);
                }
                main.add(targets);
            }
            json.put(source, Map.of("main", main));
        }
        return json;
    }

    /**
     * Reads an output-boundary JSON map. Nodes that carry a {@code main} property inline have it merged into
     * the connection map.
     */
    @SuppressWarnings("unchecked")
    public static WorkflowGraph fromJson(Map<String, Object> json) {
        String name = json.get("name") instanceof String text && !text.isBlank() ? text : DEFAULT_NAME;
        List<WorkflowNode> nodes = new ArrayList<>();
        Map<String, Object> rawConnections = new LinkedHashMap<>();
        if (json.get("connections") instanceof Map<?, ?> connections) {
            rawConnections.putAll((Map<String, Object>) connections);
        }
        if (json.get("nodes") instanceof List<?> rawNodes) {
            for (Object rawNode : rawNodes) {
                if (!(rawNode instanceof Map<?, ?> nodeMap)) {
                    continue;
                }
                WorkflowNodeReader.read(nodeMap).ifPresent(node -> {
                    nodes.add(node);
                    Object inline = nodeMap.get("main");
                    if (inline != null && !rawConnections.containsKey(node.name())) {
                        rawConnections.put(node.name(), Map.of("main", inline));
                    }
                });
            }
        }
        Map<String, Object> settings = json.get("settings") instanceof Map<?, ?> s
                ? new LinkedHashMap<>((Map<String, Object>) s)
                : new LinkedHashMap<>();
        return new WorkflowGraph(name, nodes, ConnectionNormalizer.normalize(rawConnections), settings);
    }
}
