package com.example.workflowsynth.fragment;

import java.util.Locale;

/**
 * Derives the id prefix of a fragment from its name.
 */
public final class FragmentPrefixes {

    private FragmentPrefixes() {
    }

    /** Lowercased name with every non-alphanumeric character replaced by {@code _}. */
    public static String of(String fragmentName) {
        if (fragmentName == null || fragmentName.isBlank()) {
            return "fragment";
        }
        return fragmentName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }
}
