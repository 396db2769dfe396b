package com.example.workflowsynth.fragment;

import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills parameters a node type needs to load but the generator left out. Present values are never overwritten.
 */
public final class ParameterDefaults {

    private static final Map<String, Object> STRING_EQUALS_CONDITION = Map.of(
            "leftValue", "={{ $json.field }}",
            "rightValue", "value",
            "operator", Map.of("type", "string", "operation", "equals")
    );

    private static final Map<String, Map<String, Object>> DEFAULTS = Map.of(
            NodeTypes.SET, Map.of(
                    "mode", "manual",
                    "values", Map.of("values", List.of())),
            NodeTypes.CODE, Map.of(
                    "language", "javaScript",
                    "jsCode", "return items;"),
            NodeTypes.HTTP_REQUEST, Map.of(
                    "method", "GET",
                    "url", "https://api.example.com",
                    "options", Map.of()),
            NodeTypes.IF, Map.of(
                    "conditions", Map.of(
                            "options", Map.of("version", 2),
                            "conditions", List.of(STRING_EQUALS_CONDITION))),
            NodeTypes.SWITCH, Map.of(
                    "rules", Map.of("rules", List.of(Map.of(
                            "conditions", Map.of("conditions", List.of(STRING_EQUALS_CONDITION)),
                            "output", 0)))),
            NodeTypes.MERGE, Map.of(
                    "mode", "combine",
                    "combinationMode", "mergeByPosition"),
            NodeTypes.EMAIL_SEND, Map.of(
                    "fromEmail", "noreply@example.com",
                    "toEmail", "={{ $json.email }}",
                    "subject", "Notification",
                    "text", "Email content here"),
            NodeTypes.WEBHOOK, Map.of(
                    "path", "webhook",
                    "httpMethod", "POST",
                    "responseMode", "lastNode"),
            NodeTypes.CRON, Map.of(
                    "cronTimes", Map.of("item", List.of(Map.of("mode", "everyMinute"))))
    );

    private ParameterDefaults() {
    }

    public static WorkflowNode apply(WorkflowNode node) {
        Map<String, Object> defaults = node.type() != null ? DEFAULTS.get(node.type()) : null;
        if (defaults == null) {
            return node;
        }
        Map<String, Object> parameters = new LinkedHashMap<>(node.parameters());
        boolean changed = false;
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            if (parameters.get(entry.getKey()) == null) {
                parameters.put(entry.getKey(), entry.getValue());
                changed = true;
            }
        }
        return changed ? node.withParameters(parameters) : node;
    }
}
