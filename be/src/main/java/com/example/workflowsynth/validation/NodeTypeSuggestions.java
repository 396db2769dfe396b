package com.example.workflowsynth.validation;

import com.example.workflowsynth.domain.NodeTypes;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Suggests a replacement for an invalid node type: first from a table of common mistakes, then from keywords in
 * the node's name. The suggestion is reported, never applied.
 */
public final class NodeTypeSuggestions {

    private static final String ERROR_TRIGGER = NodeTypes.ERROR_TRIGGER;
    private static final String HTTP_REQUEST = NodeTypes.HTTP_REQUEST;
    private static final String WHATSAPP = NodeTypes.PREFIX + "whatsappBusiness";

    private static final Map<String, String> COMMON_MISTAKES = Map.ofEntries(
            Map.entry("errorWorkflow", ERROR_TRIGGER),
            Map.entry("errorTrigger", ERROR_TRIGGER),
            Map.entry(NodeTypes.PREFIX + "errorWorkflow", ERROR_TRIGGER),
            Map.entry("emailSend", NodeTypes.EMAIL_SEND),
            Map.entry("emailSendSmtp", NodeTypes.EMAIL_SEND),
            Map.entry("sendEmail", NodeTypes.EMAIL_SEND),
            Map.entry("mongoDb", NodeTypes.MONGO_DB),
            Map.entry("mongodb", NodeTypes.MONGO_DB),
            Map.entry("httpGet", HTTP_REQUEST),
            Map.entry("httpPost", HTTP_REQUEST),
            Map.entry("apiRequest", HTTP_REQUEST),
            Map.entry("whatsApp", WHATSAPP),
            Map.entry("whatsapp", WHATSAPP)
    );

    private NodeTypeSuggestions() {
    }

    public static Optional<String> suggest(String invalidType, String nodeName) {
        if (invalidType != null && COMMON_MISTAKES.containsKey(invalidType)) {
            return Optional.of(COMMON_MISTAKES.get(invalidType));
        }
        if (nodeName == null) {
            return Optional.empty();
        }
        String name = nodeName.toLowerCase(Locale.ROOT);
        if (name.contains("error") && name.contains("trigger")) {
            return Optional.of(ERROR_TRIGGER);
        }
        if (name.contains("email") || name.contains("mail")) {
            return Optional.of(NodeTypes.EMAIL_SEND);
        }
        if (name.contains("record") || name.contains("log") || name.contains("store") || name.contains("save")) {
            return Optional.of(HTTP_REQUEST);
        }
        return Optional.empty();
    }
}
