package com.example.workflowsynth.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Canonical connection map: source node name to its output ports, each port holding one ordered target group.
 * <p>
 * The list index is the port number ({@link Ports#SUCCESS}, {@link Ports#ERROR}). A port can be present but empty,
 * e.g. when only the error port of a node is wired. Iteration order follows insertion order.
 * </p>
 * Not thread-safe; each repair phase works on its own copy.
 */
public final class ConnectionMap {

    private final Map<String, List<List<TargetReference>>> outputs = new LinkedHashMap<>();

    public static ConnectionMap empty() {
        return new ConnectionMap();
    }

    public ConnectionMap copy() {
        ConnectionMap copy = new ConnectionMap();
        outputs.forEach((source, ports) -> {
            List<List<TargetReference>> portsCopy = new ArrayList<>();
            for (List<TargetReference> group : ports) {
                portsCopy.add(new ArrayList<>(group));
            }
            copy.outputs.put(source, portsCopy);
        });
        return copy;
    }

    /**
     * Appends {@code target} to the group of {@code source}'s {@code port}.
     *
     * @return false if the same target is already present on that port
     */
    public boolean add(String source, int port, TargetReference target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (port < 0) {
            throw new IllegalArgumentException("port must be >= 0: " + port);
        }
        List<List<TargetReference>> ports = outputs.computeIfAbsent(source, k -> new ArrayList<>());
        while (ports.size() <= port) {
            ports.add(new ArrayList<>());
        }
        List<TargetReference> group = ports.get(port);
        if (group.contains(target)) {
            return false;
        }
        group.add(target);
        return true;
    }

    public boolean add(Edge edge) {
        return add(edge.source(), edge.port(), edge.target());
    }

    /**
     * Registers {@code source} with the given ports as-is: empty ports, an empty port list and repeated targets
     * are kept. Targets are appended when {@code source} already has ports.
     */
    public void putPorts(String source, List<List<TargetReference>> ports) {
        List<List<TargetReference>> existing = outputs.computeIfAbsent(source, k -> new ArrayList<>());
        for (int port = 0; port < ports.size(); port++) {
            while (existing.size() <= port) {
                existing.add(new ArrayList<>());
            }
            existing.get(port).addAll(ports.get(port));
        }
    }

    public void putAll(ConnectionMap other) {
        other.outputs.forEach(this::putPorts);
    }

    public List<List<TargetReference>> ports(String source) {
        List<List<TargetReference>> ports = outputs.get(source);
        if (ports == null) {
            return List.of();
        }
        List<List<TargetReference>> view = new ArrayList<>(ports.size());
        for (List<TargetReference> group : ports) {
            view.add(Collections.unmodifiableList(group));
        }
        return Collections.unmodifiableList(view);
    }

    public List<TargetReference> targets(String source, int port) {
        List<List<TargetReference>> ports = outputs.get(source);
        if (ports == null || port >= ports.size()) {
            return List.of();
        }
        return Collections.unmodifiableList(ports.get(port));
    }

    public Set<String> sources() {
        return Collections.unmodifiableSet(outputs.keySet());
    }

    public boolean hasOutgoing(String source) {
        List<List<TargetReference>> ports = outputs.get(source);
        return ports != null && ports.stream().anyMatch(group -> !group.isEmpty());
    }

    public boolean hasEdge(String source, String target) {
        return edges().anyMatch(edge -> edge.source().equals(source) && edge.target().node().equals(target));
    }

    /** Names referenced as an edge target, in first-seen order. */
    public Set<String> targetNames() {
        Set<String> names = new LinkedHashSet<>();
        edges().forEach(edge -> names.add(edge.target().node()));
        return names;
    }

    /** Sources with at least one target, in insertion order. */
    public Set<String> sourcesWithTargets() {
        Set<String> names = new LinkedHashSet<>();
        for (String source : outputs.keySet()) {
            if (hasOutgoing(source)) {
                names.add(source);
            }
        }
        return names;
    }

    public Stream<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        outputs.forEach((source, ports) -> {
            for (int port = 0; port < ports.size(); port++) {
                for (TargetReference target : ports.get(port)) {
                    edges.add(new Edge(source, port, target));
                }
            }
        });
        return edges.stream();
    }

    public boolean isEmpty() {
        return edges().findAny().isEmpty();
    }

    /**
     * Removes every edge pointing at {@code target}.
     *
     * @return the removed edges
     */
    public List<Edge> removeTargetsTo(String target) {
        List<Edge> removed = new ArrayList<>();
        outputs.forEach((source, ports) -> {
            for (int port = 0; port < ports.size(); port++) {
                int p = port;
                ports.get(port).removeIf(ref -> {
                    if (ref.node().equals(target)) {
                        removed.add(new Edge(source, p, ref));
                        return true;
                    }
                    return false;
                });
            }
        });
        return removed;
    }

    /** Returns a copy with every source and target name passed through {@code rename}. */
    public ConnectionMap renamed(UnaryOperator<String> rename) {
        ConnectionMap renamed = new ConnectionMap();
        outputs.forEach((source, ports) -> {
            List<List<TargetReference>> newPorts = new ArrayList<>();
            for (List<TargetReference> group : ports) {
                List<TargetReference> newGroup = new ArrayList<>();
                for (TargetReference ref : group) {
                    newGroup.add(ref.withNode(rename.apply(ref.node())));
                }
                newPorts.add(newGroup);
            }
            renamed.putPorts(rename.apply(source), newPorts);
        });
        return renamed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionMap other)) {
            return false;
        }
        return outputs.equals(other.outputs);
    }

    @Override
    public int hashCode() {
        return outputs.hashCode();
    }

    @Override
    public String toString() {
        return "ConnectionMap" + outputs;
    }
}
