package com.example.workflowsynth.domain;

/**
 * Flattened view of one connection: {@code source} output {@code port} to {@code target}.
 */
public record Edge(String source, int port, TargetReference target) {
}
