package com.example.workflowsynth.fragment;

import com.example.workflowsynth.codec.JsonReplies;
import com.example.workflowsynth.codec.WorkflowNodeReader;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.IssueKind;
import com.example.workflowsynth.validation.ValidationIssue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns untrusted generator output into a {@link FragmentDraft}.
 * <p>
 * Never throws for bad input: unparseable text, a non-object root or a missing {@code nodes} array yields an
 * empty draft carrying a {@link IssueKind#MALFORMED_FRAGMENT} warning. A node object without id or name is
 * named {@code "<fragment> node <n>"}; a node entry that is not an object is dropped. Both are reported as
 * {@link IssueKind#MALFORMED_NODE} warnings.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class FragmentParser {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() { };

    private final JsonMapper jsonMapper;

    /**
     * @param definition raw model reply text, or an already decoded JSON object
     */
    public FragmentDraft parse(String fragmentName, Object definition) {
        if (definition instanceof Map<?, ?> map) {
            return parseObject(fragmentName, toStringKeyed(map));
        }
        if (definition instanceof String text) {
            return parseText(fragmentName, text);
        }
        return malformed(fragmentName, "fragment definition is missing or not a JSON object");
    }

    public FragmentDraft parseText(String fragmentName, String text) {
        Optional<String> json = JsonReplies.extractObject(text);
        if (json.isEmpty()) {
            return malformed(fragmentName, "fragment output contains no JSON object");
        }
        try {
            return parseObject(fragmentName, jsonMapper.readValue(json.get(), JSON_OBJECT));
        } catch (JacksonException e) {
            log.warn("Unparseable fragment output fragment={} error={}", fragmentName, e.getMessage());
            return malformed(fragmentName, "fragment output is not valid JSON: " + e.getMessage());
        }
    }

    FragmentDraft parseObject(String fragmentName, Map<String, Object> root) {
        if (root == null || !(root.get("nodes") instanceof List<?> rawNodes)) {
            return malformed(fragmentName, "fragment has no nodes array");
        }
        Map<String, Object> connections = new LinkedHashMap<>();
        if (root.get("connections") instanceof Map<?, ?> rawConnections) {
            connections.putAll(toStringKeyed(rawConnections));
        }
        List<WorkflowNode> nodes = new ArrayList<>();
        List<RepairAction> actions = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (int i = 0; i < rawNodes.size(); i++) {
            Object rawNode = rawNodes.get(i);
            if (!(rawNode instanceof Map<?, ?> nodeMap)) {
                String label = "node entry " + (i + 1);
                log.warn("Dropping non-object node entry fragment={} index={}", fragmentName, i);
                warnings.add(ValidationIssue.warning(null, label, IssueKind.MALFORMED_NODE,
                        "Fragment \"" + fragmentName + "\" has a " + label + " that is not a JSON object; it was dropped",
                        "Describe every node as an object with id, name, type and position"));
                actions.add(RepairAction.note(RepairAction.Kind.NODE_DROPPED, label, "not a JSON object"));
                continue;
            }
            Optional<WorkflowNode> node = WorkflowNodeReader.read(nodeMap);
            if (node.isEmpty()) {
                String generated = fragmentName + " node " + (i + 1);
                Map<Object, Object> named = new LinkedHashMap<>(nodeMap);
                named.put("name", generated);
                node = WorkflowNodeReader.read(named);
                log.debug("Named node without id or name fragment={} name={}", fragmentName, generated);
                warnings.add(ValidationIssue.warning(null, generated, IssueKind.MALFORMED_NODE,
                        "Node " + (i + 1) + " of fragment \"" + fragmentName + "\" has no id or name; named \""
                                + generated + "\"",
                        "Give every node a unique name"));
                actions.add(RepairAction.note(RepairAction.Kind.NODE_NAMED, generated, "node had no id or name"));
            }
            nodes.add(node.get());
            Object inline = nodeMap.get("main");
            if (inline != null) {
                String name = node.get().name();
                if (!connections.containsKey(name)) {
                    connections.put(name, Map.of("main", inline));
                }
                actions.add(RepairAction.note(RepairAction.Kind.INLINE_CONNECTIONS_MOVED, name,
                        "inline connections moved to the connection map"));
            }
        }
        String startNode = firstString(root, "start_node", "startNode");
        List<String> endNodes = stringList(root.get("end_nodes") != null ? root.get("end_nodes") : root.get("endNodes"));
        log.debug("Parsed fragment={} nodes={} connectionSources={}", fragmentName, nodes.size(), connections.size());
        return new FragmentDraft(fragmentName, nodes, connections, startNode, endNodes, warnings, actions);
    }

    private FragmentDraft malformed(String fragmentName, String reason) {
        log.warn("Malformed fragment treated as empty fragment={} reason={}", fragmentName, reason);
        return FragmentDraft.empty(fragmentName, ValidationIssue.warning(
                fragmentName, fragmentName, IssueKind.MALFORMED_FRAGMENT,
                "Fragment \"" + fragmentName + "\" is malformed: " + reason,
                "Regenerate the fragment"));
    }

    private static String firstString(Map<String, Object> root, String... keys) {
        for (String key : keys) {
            if (root.get(key) instanceof String value && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof String text && !text.isBlank()) {
                    result.add(text.trim());
                }
            }
        } else if (value instanceof String text && !text.isBlank()) {
            result.add(text.trim());
        }
        return result;
    }

    private static Map<String, Object> toStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
