package com.example.workflowsynth.synthesis;

/**
 * Produces the raw definition of one fragment. Implementations may block and may throw; callers treat a
 * failure as an empty fragment.
 */
public interface FragmentGenerator {

    /**
     * @param branch the branch to generate
     * @param prompt the user's original request
     * @return raw text expected to contain one JSON object {@code { nodes, connections, start_node?, end_nodes? }}
     */
    String generate(BranchPlan branch, String prompt);
}
