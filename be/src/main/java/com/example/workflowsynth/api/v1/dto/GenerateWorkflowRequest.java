package com.example.workflowsynth.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for generating a workflow from a natural-language prompt.
 */
public record GenerateWorkflowRequest(
        String name,
        @NotBlank String prompt
) {}
