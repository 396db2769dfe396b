package com.example.workflowsynth.repair;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A structural change made while repairing or assembling a graph, returned to callers
 * so every automatic decision stays visible.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepairAction(Kind kind, String source, Integer port, String target, String detail) {

    public enum Kind {
        LINEAR_CHAIN,
        REATTACHED,
        RENAMED,
        FANNED_OUT,
        MERGE_WIRED,
        TRIGGER_EDGE_REMOVED,
        INLINE_CONNECTIONS_MOVED,
        NODE_NAMED,
        NODE_DROPPED,
        UNRESOLVED_ORPHAN,
        FRAGMENT_SKIPPED
    }

    public RepairAction {
        Objects.requireNonNull(kind, "kind");
    }

    public static RepairAction edge(Kind kind, String source, int port, String target, String detail) {
        return new RepairAction(kind, source, port, target, detail);
    }

    public static RepairAction note(Kind kind, String target, String detail) {
        return new RepairAction(kind, null, null, target, detail);
    }
}
