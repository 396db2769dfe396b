package com.example.workflowsynth.api.v1.dto;

import com.example.workflowsynth.assembly.MergePoint;
import com.example.workflowsynth.assembly.TriggerType;
import com.example.workflowsynth.synthesis.AssemblyRequest;
import com.example.workflowsynth.synthesis.FragmentInput;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for assembling caller-supplied fragments into one workflow.
 * {@code triggerType} is {@code webhook}, {@code schedule} or {@code manual}; anything else means webhook.
 */
public record AssembleWorkflowRequest(
        String name,
        String triggerType,
        @NotNull @NotEmpty @Valid List<FragmentDefinitionDto> fragments,
        List<MergePointDto> mergePoints
) {

    public AssemblyRequest toAssemblyRequest() {
        List<FragmentInput> inputs = fragments.stream()
                .map(f -> new FragmentInput(f.name(), f.definition()))
                .toList();
        List<MergePoint> merges = mergePoints != null
                ? mergePoints.stream().map(m -> new MergePoint(m.name(), m.mergesFragments())).toList()
                : List.of();
        return new AssemblyRequest(name, TriggerType.fromValue(triggerType), inputs, merges);
    }
}
