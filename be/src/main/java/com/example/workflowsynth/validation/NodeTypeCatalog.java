package com.example.workflowsynth.validation;

import com.example.workflowsynth.domain.NodeTypes;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Known node types. A type is accepted when it is in the catalog or matches one of the community
 * namespacing patterns.
 */
public final class NodeTypeCatalog {

    private static final List<Pattern> VALID_PATTERNS = List.of(
            Pattern.compile("^n8n-nodes-base\\."),
            Pattern.compile("^n8n-nodes-"),
            Pattern.compile("^@[^/]+/n8n-nodes-")
    );

    private final Map<String, NodeTypeDefinition> definitions = new LinkedHashMap<>();

    public NodeTypeCatalog(Collection<NodeTypeDefinition> definitions) {
        definitions.forEach(d -> this.definitions.put(d.type(), d));
    }

    public static NodeTypeCatalog standard() {
        return new NodeTypeCatalog(List.of(
                def("webhook", "trigger", "Triggers workflow via HTTP webhook"),
                def("scheduleTrigger", "trigger", "Triggers workflow on schedule"),
                def("errorTrigger", "trigger", "Catches errors from other workflows"),
                def("manualTrigger", "trigger", "Manual workflow trigger"),
                def("cron", "trigger", "Triggers workflow on a cron expression"),
                def("emailSend", "communication", "Send emails"),
                def("slack", "communication", "Slack integration"),
                def("telegram", "communication", "Telegram messaging"),
                def("twilio", "communication", "SMS and voice calls"),
                def("discord", "communication", "Discord messaging"),
                def("whatsappBusiness", "communication", "WhatsApp Business messaging"),
                def("function", "data", "Custom JavaScript code"),
                def("code", "data", "Execute code (JS/Python)"),
                def("set", "data", "Set or modify data"),
                def("merge", "data", "Merge multiple data streams"),
                def("splitInBatches", "data", "Process data in batches"),
                def("if", "flow", "Conditional branching"),
                def("switch", "flow", "Multiple condition routing"),
                def("wait", "flow", "Pause workflow execution"),
                def("httpRequest", "http", "Make HTTP requests"),
                def("respondToWebhook", "http", "Send webhook response"),
                def("graphql", "http", "GraphQL queries"),
                def("postgres", "database", "PostgreSQL operations"),
                def("mysql", "database", "MySQL operations"),
                def("mongoDb", "database", "MongoDB operations"),
                def("redis", "database", "Redis cache operations"),
                def("readBinaryFile", "files", "Read files from disk"),
                def("writeBinaryFile", "files", "Write files to disk"),
                def("spreadsheetFile", "files", "Work with spreadsheet files"),
                def("googleSheets", "cloud", "Google Sheets operations"),
                def("googleDrive", "cloud", "Google Drive operations"),
                def("aws", "cloud", "AWS services"),
                def("html", "utility", "Generate HTML content"),
                def("crypto", "utility", "Cryptographic operations"),
                def("dateTime", "utility", "Date and time operations"),
                def("github", "integration", "GitHub operations"),
                def("gitlab", "integration", "GitLab operations"),
                def("jira", "integration", "Jira issue tracking"),
                def("notion", "integration", "Notion workspace")
        ));
    }

    private static NodeTypeDefinition def(String shortType, String category, String description) {
        return new NodeTypeDefinition(NodeTypes.PREFIX + shortType, category, description);
    }

    public boolean contains(String type) {
        return definitions.containsKey(type);
    }

    public boolean isValid(String type) {
        if (type == null || type.isBlank()) {
            return false;
        }
        return contains(type) || VALID_PATTERNS.stream().anyMatch(p -> p.matcher(type).find());
    }

    public Optional<NodeTypeDefinition> find(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    /** All definitions sorted by type. */
    public List<NodeTypeDefinition> all() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(NodeTypeDefinition::type))
                .toList();
    }
}
