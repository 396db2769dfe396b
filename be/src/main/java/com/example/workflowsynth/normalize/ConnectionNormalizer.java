package com.example.workflowsynth.normalize;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.TargetReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collapses the heterogeneous connection records a generator produces into a {@link ConnectionMap}.
 * <p>
 * Accepted per-source values: {@code {"main": [[...], [...]]}}, {@code {"main": [...]}} (a flat list is one
 * group on port 0), a bare list (treated as {@code main}), a single target object, or a bare target name.
 * Targets may be names, partial objects or canonical objects. Targets naming unknown nodes are kept; the
 * validator reports them.
 * </p>
 */
public final class ConnectionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionNormalizer.class);

    private ConnectionNormalizer() {
    }

    public static ConnectionMap normalize(Map<String, ?> rawConnections) {
        ConnectionMap normalized = ConnectionMap.empty();
        if (rawConnections == null) {
            return normalized;
        }
        rawConnections.forEach((source, value) -> {
            if (source == null || source.isBlank()) {
                return;
            }
            List<List<TargetReference>> ports = normalizePorts(value);
            if (ports == null) {
                log.debug("Skipping connection record with unrecognized shape source={}", source);
                return;
            }
            normalized.putPorts(source, ports);
        });
        return normalized;
    }

    /**
     * @return the ports for one source, or null if {@code value} has no recognizable shape
     */
    static List<List<TargetReference>> normalizePorts(Object value) {
        Object main = value;
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey("main")) {
                main = map.get("main");
            } else if (map.containsKey("node")) {
                return List.of(normalizeGroup(value));
            } else {
                return null;
            }
        }
        if (main instanceof String) {
            return List.of(normalizeGroup(main));
        }
        if (!(main instanceof List<?> portList)) {
            return null;
        }
        if (portList.isEmpty()) {
            return List.of();
        }
        boolean nested = portList.stream().anyMatch(element -> element instanceof List<?>);
        if (!nested) {
            return List.of(normalizeGroup(portList));
        }
        List<List<TargetReference>> ports = new ArrayList<>();
        for (Object group : portList) {
            ports.add(normalizeGroup(group));
        }
        return ports;
    }

    /** Normalizes one target group; a non-list value is a group of one. */
    static List<TargetReference> normalizeGroup(Object rawGroup) {
        List<TargetReference> group = new ArrayList<>();
        if (rawGroup instanceof List<?> elements) {
            for (Object element : elements) {
                ConnectionShape.of(element).map(ConnectionShape::toReference).ifPresent(group::add);
            }
        } else if (rawGroup != null) {
            ConnectionShape.of(rawGroup).map(ConnectionShape::toReference).ifPresent(group::add);
        }
        return group;
    }
}
