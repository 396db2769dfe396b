package com.example.workflowsynth.normalize;

import com.example.workflowsynth.domain.TargetReference;

import java.util.Map;
import java.util.Optional;

/**
 * The shapes a single connection target arrives in from the generator.
 * Every shape collapses to one {@link TargetReference}.
 */
public sealed interface ConnectionShape
        permits ConnectionShape.NameOnly, ConnectionShape.Partial, ConnectionShape.Canonical {

    TargetReference toReference();

    /** A bare target node name, e.g. {@code "Send Email"}. */
    record NameOnly(String node) implements ConnectionShape {
        @Override
        public TargetReference toReference() {
            return TargetReference.main(node);
        }
    }

    /** An object naming the target but missing {@code type} and/or {@code index}. */
    record Partial(String node, String type, Integer index) implements ConnectionShape {
        @Override
        public TargetReference toReference() {
            return new TargetReference(node, type, index != null ? index : 0);
        }
    }

    /** A fully specified {@code {node, type, index}} object. */
    record Canonical(TargetReference reference) implements ConnectionShape {
        @Override
        public TargetReference toReference() {
            return reference;
        }
    }

    /**
     * Classifies a raw JSON value. Values that cannot name a target (numbers, objects without {@code node},
     * blank strings) yield empty.
     */
    static Optional<ConnectionShape> of(Object raw) {
        if (raw instanceof TargetReference ref) {
            return Optional.of(new Canonical(ref));
        }
        if (raw instanceof String name) {
            return name.isBlank() ? Optional.empty() : Optional.of(new NameOnly(name.trim()));
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        Object node = map.get("node");
        if (!(node instanceof String nodeName) || nodeName.isBlank()) {
            return Optional.empty();
        }
        String type = map.get("type") instanceof String t && !t.isBlank() ? t : null;
        Integer index = parseIndex(map.get("index"));
        if (type != null && index != null) {
            return Optional.of(new Canonical(new TargetReference(nodeName, type, index)));
        }
        return Optional.of(new Partial(nodeName, type, index));
    }

    private static Integer parseIndex(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
