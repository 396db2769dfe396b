package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.Edge;
import com.example.workflowsynth.domain.TargetReference;

/**
 * A proposed edge that reattaches an orphan: {@code source} port {@code port} into {@code target}.
 */
public record Attachment(String source, int port, String target) {

    public Edge toEdge() {
        return new Edge(source, port, TargetReference.main(target));
    }
}
