package com.example.workflowsynth.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * One fragment to assemble. {@code definition} is either the fragment JSON object or raw model text containing it.
 */
public record FragmentDefinitionDto(
        @NotBlank String name,
        Object definition
) {}
