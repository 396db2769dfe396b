package com.example.workflowsynth.codec;

import com.example.workflowsynth.domain.Position;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a node from a loosely typed JSON map as produced by a generator.
 * Missing fields get defaults; only a node with neither id nor name is rejected.
 */
public final class WorkflowNodeReader {

    private WorkflowNodeReader() {
    }

    public static Optional<WorkflowNode> read(Map<?, ?> raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String id = trimToNull(raw.get("id"));
        String name = trimToNull(raw.get("name"));
        if (id == null && name == null) {
            return Optional.empty();
        }
        return Optional.of(new WorkflowNode(
                id != null ? id : name,
                name != null ? name : id,
                trimToNull(raw.get("type")),
                readTypeVersion(raw.get("typeVersion")),
                readPosition(raw.get("position")),
                readMap(raw.get("parameters")),
                readMap(raw.get("credentials"))
        ));
    }

    static Position readPosition(Object value) {
        if (value instanceof List<?> list && list.size() >= 2) {
            Double x = toDouble(list.get(0));
            Double y = toDouble(list.get(1));
            if (x != null && y != null) {
                return new Position(x, y);
            }
        }
        if (value instanceof Map<?, ?> map) {
            Double x = toDouble(map.get("x"));
            Double y = toDouble(map.get("y"));
            if (x != null && y != null) {
                return new Position(x, y);
            }
        }
        return Position.ORIGIN;
    }

    private static double readTypeVersion(Object value) {
        Double version = toDouble(value);
        return version != null ? version : 1;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return new LinkedHashMap<>();
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static String trimToNull(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
