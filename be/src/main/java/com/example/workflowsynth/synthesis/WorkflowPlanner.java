package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.MergePoint;
import com.example.workflowsynth.assembly.TriggerType;
import com.example.workflowsynth.codec.JsonReplies;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the chat model to split a request into branches. Any unusable reply falls back to
 * {@link KeywordPlans#plan(String)}.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowPlanner {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() { };

    static final String SYSTEM_PROMPT = """
            You are an expert automation architect. You break workflow requests into independent branches.
            Reply with a single JSON object and nothing else.""";

    private static final String PLAN_TEMPLATE = """
            Analyze this workflow request and identify its independent branches.

            Request: %s

            Return a JSON object with this structure:
            {
              "mainTrigger": { "type": "webhook|schedule|manual", "description": "what starts the workflow" },
              "branches": [
                {
                  "name": "short branch name",
                  "description": "what this branch does",
                  "triggerCondition": "when this branch runs",
                  "parallel": true,
                  "estimatedNodes": 5
                }
              ],
              "mergePoints": [ { "name": "merge node name", "mergesBranches": ["branch names"] } ]
            }""";

    private final ChatModel chatModel;
    private final JsonMapper jsonMapper;

    public WorkflowPlan plan(String prompt) {
        String reply;
        try {
            List<ChatMessage> messages = List.of(
                    SystemMessage.from(SYSTEM_PROMPT),
                    UserMessage.from(PLAN_TEMPLATE.formatted(prompt)));
            reply = chatModel.chat(messages).aiMessage().text();
        } catch (RuntimeException e) {
            log.warn("Planning call failed, using keyword plan error={}", e.getMessage());
            return KeywordPlans.plan(prompt);
        }
        Optional<WorkflowPlan> plan = parse(reply, prompt);
        if (plan.isEmpty()) {
            log.warn("Unusable plan reply, using keyword plan replyLength={}", reply != null ? reply.length() : 0);
            return KeywordPlans.plan(prompt);
        }
        return plan.get();
    }

    Optional<WorkflowPlan> parse(String reply, String prompt) {
        Optional<String> json = JsonReplies.extractObject(reply);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> root;
        try {
            root = jsonMapper.readValue(json.get(), JSON_OBJECT);
        } catch (JacksonException e) {
            log.debug("Plan reply is not valid JSON error={}", e.getMessage());
            return Optional.empty();
        }
        List<BranchPlan> branches = new ArrayList<>();
        if (root.get("branches") instanceof List<?> rawBranches) {
            for (Object raw : rawBranches) {
                if (raw instanceof Map<?, ?> branch && branch.get("name") instanceof String name && !name.isBlank()) {
                    branches.add(new BranchPlan(name.trim(),
                            text(branch.get("description"), prompt),
                            text(branch.get("triggerCondition"), "always"),
                            Boolean.TRUE.equals(branch.get("parallel")),
                            number(branch.get("estimatedNodes"), 5)));
                }
            }
        }
        if (branches.isEmpty()) {
            return Optional.empty();
        }
        TriggerPlan trigger = new TriggerPlan(TriggerType.WEBHOOK, "");
        if (root.get("mainTrigger") instanceof Map<?, ?> rawTrigger) {
            trigger = new TriggerPlan(TriggerType.fromValue(text(rawTrigger.get("type"), null)),
                    text(rawTrigger.get("description"), ""));
        }
        List<MergePoint> mergePoints = new ArrayList<>();
        if (root.get("mergePoints") instanceof List<?> rawMerges) {
            for (Object raw : rawMerges) {
                if (raw instanceof Map<?, ?> merge) {
                    mergePoints.add(new MergePoint(text(merge.get("name"), null), strings(merge.get("mergesBranches"))));
                }
            }
        }
        WorkflowPlan plan = new WorkflowPlan(trigger, branches, mergePoints);
        log.info("Planned workflow branches={} mergePoints={} trigger={}",
                branches.size(), mergePoints.size(), trigger.type().getValue());
        return Optional.of(plan);
    }

    private static String text(Object value, String fallback) {
        return value instanceof String s && !s.isBlank() ? s.trim() : fallback;
    }

    private static int number(Object value, int fallback) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof String s && !s.isBlank()) {
                    result.add(s.trim());
                }
            }
        }
        return result;
    }
}
