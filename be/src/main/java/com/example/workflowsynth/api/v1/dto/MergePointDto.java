package com.example.workflowsynth.api.v1.dto;

import java.util.List;

public record MergePointDto(String name, List<String> mergesFragments) {}
