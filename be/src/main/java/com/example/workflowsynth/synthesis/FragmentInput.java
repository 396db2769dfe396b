package com.example.workflowsynth.synthesis;

import java.util.Objects;

/**
 * A named fragment definition: raw model text or an already decoded JSON object.
 */
public record FragmentInput(String name, Object definition) {

    public FragmentInput {
        Objects.requireNonNull(name, "name");
    }
}
