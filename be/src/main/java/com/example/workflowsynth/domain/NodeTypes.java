package com.example.workflowsynth.domain;

import java.util.Locale;

/**
 * Well-known node type identifiers and the role predicates the repair and validation passes rely on.
 */
public final class NodeTypes {

    public static final String PREFIX = "n8n-nodes-base.";

    public static final String WEBHOOK = PREFIX + "webhook";
    public static final String SCHEDULE_TRIGGER = PREFIX + "scheduleTrigger";
    public static final String MANUAL_TRIGGER = PREFIX + "manualTrigger";
    public static final String ERROR_TRIGGER = PREFIX + "errorTrigger";
    public static final String CRON = PREFIX + "cron";
    public static final String MERGE = PREFIX + "merge";
    public static final String IF = PREFIX + "if";
    public static final String SWITCH = PREFIX + "switch";
    public static final String RESPOND_TO_WEBHOOK = PREFIX + "respondToWebhook";
    public static final String HTTP_REQUEST = PREFIX + "httpRequest";
    public static final String EMAIL_SEND = PREFIX + "emailSend";
    public static final String SET = PREFIX + "set";
    public static final String CODE = PREFIX + "code";
    public static final String MONGO_DB = PREFIX + "mongoDb";
    public static final String POSTGRES = PREFIX + "postgres";
    public static final String MYSQL = PREFIX + "mysql";

    private NodeTypes() {
    }

    /** Entry types: never receive edges, start execution. */
    public static boolean isTrigger(String type) {
        if (type == null) {
            return false;
        }
        String lower = type.toLowerCase(Locale.ROOT);
        return lower.contains("trigger")
                || (lower.contains("webhook") && !RESPOND_TO_WEBHOOK.equals(type))
                || lower.contains("cron")
                || lower.contains("schedule");
    }

    public static boolean isTrigger(WorkflowNode node) {
        return isTrigger(node.type());
    }

    public static boolean isMerge(String type) {
        return MERGE.equals(type);
    }

    public static boolean isDecision(String type) {
        return IF.equals(type) || SWITCH.equals(type);
    }
}
