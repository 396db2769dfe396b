package com.example.workflowsynth.api.v1.dto;

/**
 * API response for one known node type.
 */
public record NodeTypeDto(String type, String category, String description) {}
