package com.example.workflowsynth.assembly;

import java.util.List;

/**
 * Declares a merge node that collects the exits of the named fragments.
 */
public record MergePoint(String name, List<String> mergesFragments) {

    public MergePoint {
        mergesFragments = mergesFragments != null ? List.copyOf(mergesFragments) : List.of();
    }
}
