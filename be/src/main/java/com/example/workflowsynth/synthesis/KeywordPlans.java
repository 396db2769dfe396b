package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.TriggerType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a plan from the features a request mentions, used when the model's plan cannot be used.
 * A request mentioning none of the known features becomes a single {@link #CORE_BRANCH} branch.
 */
public final class KeywordPlans {

    public static final String CORE_BRANCH = "Main Flow";

    static final List<String> FEATURE_KEYWORDS = List.of(
            "api", "database", "notification", "email", "sms", "validation",
            "authentication", "processing", "transformation", "integration",
            "monitoring", "logging", "error handling", "retry", "scheduling",
            "webhook", "report", "analysis", "calculation", "filtering");

    static final int BASE_NODES = 5;
    static final int NODES_PER_FEATURE = 5;
    static final int MONITORING_THRESHOLD = 20;

    private KeywordPlans() {
    }

    /** Known features mentioned in {@code prompt}, in keyword order. */
    public static List<String> features(String prompt) {
        List<String> features = new ArrayList<>();
        if (prompt == null) {
            return features;
        }
        String lower = prompt.toLowerCase(Locale.ROOT);
        for (String keyword : FEATURE_KEYWORDS) {
            if (lower.contains(keyword)) {
                features.add(keyword);
            }
        }
        return features;
    }

    public static WorkflowPlan plan(String prompt) {
        List<String> features = features(prompt);
        int total = BASE_NODES + features.size() * NODES_PER_FEATURE;

        List<BranchPlan> branches = new ArrayList<>();
        branches.add(new BranchPlan(CORE_BRANCH, prompt, "always", false,
                features.isEmpty() ? BASE_NODES : share(total, 0.3, 10)));
        if (mentions(features, "validation", "api", "authentication")) {
            branches.add(section("Input Validation", "Validate and sanitize the incoming data", prompt,
                    share(total, 0.2, 8)));
        }
        if (mentions(features, "api", "integration")) {
            branches.add(section("External Integrations", "Call the external services and APIs", prompt,
                    share(total, 0.2, 8)));
        }
        if (mentions(features, "notification", "email", "sms", "report")) {
            branches.add(section("Notifications", "Send the notifications and reports", prompt,
                    share(total, 0.2, 8)));
        }
        if (mentions(features, "error handling", "retry")) {
            branches.add(section("Error Handling", "Handle failures and retries", prompt, share(total, 0.1, 5)));
        }
        if (total > MONITORING_THRESHOLD || mentions(features, "monitoring", "logging")) {
            branches.add(section("Monitoring & Logging", "Log activity and record run metrics", prompt,
                    share(total, 0.1, 5)));
        }

        TriggerType trigger = features.contains("scheduling") ? TriggerType.SCHEDULE : TriggerType.WEBHOOK;
        return new WorkflowPlan(new TriggerPlan(trigger, "Main workflow trigger"), branches, List.of());
    }

    private static BranchPlan section(String name, String purpose, String prompt, int estimatedNodes) {
        return new BranchPlan(name, purpose + " for: " + prompt, "always", true, estimatedNodes);
    }

    private static boolean mentions(List<String> features, String... keywords) {
        for (String keyword : keywords) {
            if (features.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static int share(int total, double ratio, int cap) {
        return Math.max(2, Math.min(cap, (int) Math.floor(total * ratio)));
    }
}
