package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.TriggerType;

public record TriggerPlan(TriggerType type, String description) {

    public TriggerPlan {
        type = type != null ? type : TriggerType.WEBHOOK;
        description = description != null ? description : "";
    }
}
