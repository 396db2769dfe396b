package com.example.workflowsynth.assembly;

import com.example.workflowsynth.domain.NodeTypes;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of the synthetic trigger node that starts an assembled workflow.
 */
public enum TriggerType {
    WEBHOOK("webhook", NodeTypes.WEBHOOK, 1.1),
    SCHEDULE("schedule", NodeTypes.SCHEDULE_TRIGGER, 1.1),
    MANUAL("manual", NodeTypes.MANUAL_TRIGGER, 1);

    private final String value;
    private final String nodeType;
    private final double typeVersion;

    TriggerType(String value, String nodeType, double typeVersion) {
        this.value = value;
        this.nodeType = nodeType;
        this.typeVersion = typeVersion;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String nodeType() {
        return nodeType;
    }

    public double typeVersion() {
        return typeVersion;
    }

    /**
     * Lenient lookup: "cron" and "scheduled" map to {@link #SCHEDULE}, blank or unknown values to {@link #WEBHOOK}.
     */
    public static TriggerType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return WEBHOOK;
        }
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        if (lower.contains("schedule") || lower.contains("cron")) {
            return SCHEDULE;
        }
        if (lower.contains("manual")) {
            return MANUAL;
        }
        return WEBHOOK;
    }
}
