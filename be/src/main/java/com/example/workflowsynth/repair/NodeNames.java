package com.example.workflowsynth.repair;

import java.util.Locale;

/**
 * Keyword tests on node names, case-insensitive.
 */
final class NodeNames {

    static final String[] ERROR_KEYWORDS = {"error", "exception"};
    static final String[] FINAL_STEP_KEYWORDS = {"final", "complete", "send"};
    static final String[] MERGE_KEYWORDS = {"final", "merge"};
    static final String[] BRANCH_END_KEYWORDS = {"send", "complete", "finish", "create", "done", "update"};
    static final String[] FRAGMENT_ERROR_KEYWORDS = {"error", "exception", "handling"};

    private NodeNames() {
    }

    static boolean containsAny(String name, String... keywords) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
