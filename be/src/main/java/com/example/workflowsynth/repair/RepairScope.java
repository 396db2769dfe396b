package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable working state a reattachment pass operates on.
 * <p>
 * "Attached" means connected (fragment pass) or reachable from a root (global pass). The recent-source order
 * tracks which node most recently gained an outgoing edge.
 * </p>
 */
public final class RepairScope {

    private final List<WorkflowNode> nodes;
    private final ConnectionMap connections;
    private final Set<String> attached;
    private final LinkedHashSet<String> recentSources;
    private final Map<String, String> fragmentByNode;

    public RepairScope(List<WorkflowNode> nodes, ConnectionMap connections, Collection<String> attached,
                       Map<String, String> fragmentByNode) {
        this.nodes = List.copyOf(nodes);
        this.connections = Objects.requireNonNull(connections, "connections");
        this.attached = new LinkedHashSet<>(attached);
        this.recentSources = new LinkedHashSet<>(connections.sourcesWithTargets());
        this.fragmentByNode = fragmentByNode != null ? Map.copyOf(fragmentByNode) : Map.of();
    }

    public List<WorkflowNode> nodes() {
        return nodes;
    }

    public ConnectionMap connections() {
        return connections;
    }

    public boolean isAttached(String name) {
        return attached.contains(name);
    }

    public Optional<String> fragmentOf(String name) {
        return Optional.ofNullable(fragmentByNode.get(name));
    }

    /** The node that most recently gained an outgoing edge, other than {@code excluded}. */
    public Optional<String> mostRecentSource(String excluded) {
        List<String> ordered = new ArrayList<>(recentSources);
        for (int i = ordered.size() - 1; i >= 0; i--) {
            if (!ordered.get(i).equals(excluded)) {
                return Optional.of(ordered.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Adds the attachment's edge and marks both ends attached.
     *
     * @return false if the edge already existed
     */
    public boolean apply(Attachment attachment) {
        boolean added = connections.add(attachment.toEdge());
        attached.add(attachment.source());
        attached.add(attachment.target());
        recentSources.remove(attachment.source());
        recentSources.add(attachment.source());
        return added;
    }

    /** Replaces the attached set, e.g. after reachability was recomputed. */
    public void resetAttached(Collection<String> names) {
        attached.clear();
        attached.addAll(names);
    }
}
