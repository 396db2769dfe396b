package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.MergePoint;
import com.example.workflowsynth.assembly.TriggerType;

import java.util.List;

public record AssemblyRequest(
        String name,
        TriggerType triggerType,
        List<FragmentInput> fragments,
        List<MergePoint> mergePoints
) {
    public AssemblyRequest {
        triggerType = triggerType != null ? triggerType : TriggerType.WEBHOOK;
        fragments = fragments != null ? List.copyOf(fragments) : List.of();
        mergePoints = mergePoints != null ? List.copyOf(mergePoints) : List.of();
    }
}
