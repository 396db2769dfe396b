package com.example.workflowsynth.validation;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Node counts; {@code byType} counts nodes with a valid type only, keyed in type order.
 */
public record NodeStats(int total, int valid, int invalid, Map<String, Integer> byType) {
    public NodeStats {
        byType = byType != null ? Collections.unmodifiableMap(new TreeMap<>(byType)) : Map.of();
    }
}
