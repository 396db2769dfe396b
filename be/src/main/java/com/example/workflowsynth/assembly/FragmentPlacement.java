package com.example.workflowsynth.assembly;

import java.util.List;

/**
 * Where a fragment ended up in the assembled graph, with its names after collision handling.
 */
public record FragmentPlacement(String name, String prefix, String entry, List<String> exits, List<String> nodeNames) {

    public FragmentPlacement {
        exits = exits != null ? List.copyOf(exits) : List.of();
        nodeNames = nodeNames != null ? List.copyOf(nodeNames) : List.of();
    }
}
