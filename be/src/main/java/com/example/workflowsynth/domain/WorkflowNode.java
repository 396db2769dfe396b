package com.example.workflowsynth.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One node of an automation graph.
 * <p>
 * {@code id} is the internal key; {@code name} is the key edges reference. Both are unique within a graph.
 * {@code type} may be blank when the generator omitted it; the validator reports that case.
 * </p>
 */
public record WorkflowNode(
        String id,
        String name,
        String type,
        double typeVersion,
        Position position,
        Map<String, Object> parameters,
        Map<String, Object> credentials
) {
    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        position = position != null ? position : Position.ORIGIN;
        parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        credentials = credentials != null ? new LinkedHashMap<>(credentials) : new LinkedHashMap<>();
    }

    public static WorkflowNode of(String name, String type, double x, double y) {
        return new WorkflowNode(name, name, type, 1, new Position(x, y), Map.of(), Map.of());
    }

    public WorkflowNode withId(String newId) {
        return new WorkflowNode(newId, name, type, typeVersion, position, parameters, credentials);
    }

    public WorkflowNode withName(String newName) {
        return new WorkflowNode(id, newName, type, typeVersion, position, parameters, credentials);
    }

    public WorkflowNode withPosition(Position newPosition) {
        return new WorkflowNode(id, name, type, typeVersion, newPosition, parameters, credentials);
    }

    public WorkflowNode withParameters(Map<String, Object> newParameters) {
        return new WorkflowNode(id, name, type, typeVersion, position, newParameters, credentials);
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }
}
