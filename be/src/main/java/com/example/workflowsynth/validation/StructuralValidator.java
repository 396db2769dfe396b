package com.example.workflowsynth.validation;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.Edge;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.repair.GraphReachability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stateless structural checks over a graph. The checks are independent of each other; the graph is never
 * modified.
 */
@Slf4j
@RequiredArgsConstructor
public class StructuralValidator {

    static final List<String> HIGH_COST_TYPES = List.of(NodeTypes.MONGO_DB, NodeTypes.POSTGRES, NodeTypes.MYSQL);

    private static final String WORKFLOW_REF = "workflow";
    private static final String PATTERN_REF = "pattern";

    private final NodeTypeCatalog catalog;
    private final ValidationThresholds thresholds;

    public ValidationReport validate(WorkflowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> credentialUsage = new LinkedHashMap<>();
        int valid = 0;
        int invalid = 0;

        for (WorkflowNode node : graph.nodes()) {
            if (checkNodeType(node, issues)) {
                valid++;
                byType.merge(node.type(), 1, Integer::sum);
            } else {
                invalid++;
            }
            checkNaming(node).ifPresent(warnings::add);
            node.credentials().keySet().forEach(type -> credentialUsage.merge(type, 1, Integer::sum));
        }

        checkDuplicateNames(graph, issues);
        checkConnections(graph, issues);
        checkDisconnected(graph, issues);
        warnings.addAll(detectAntiPatterns(graph, byType));

        List<String> duplicateCredentials = new ArrayList<>();
        credentialUsage.forEach((type, count) -> {
            if (count > thresholds.credentialReuse()) {
                duplicateCredentials.add(type);
                warnings.add(ValidationIssue.warning(WORKFLOW_REF, "Workflow", IssueKind.DUPLICATE_CREDENTIAL,
                        "Credential type \"" + type + "\" is used " + count + " times",
                        "Consider using a single credential instance for all nodes of the same type"));
            }
        });

        ValidationReport report = new ValidationReport(issues, warnings,
                new NodeStats(valid + invalid, valid, invalid, byType),
                new CredentialStats(new ArrayList<>(new TreeSet<>(credentialUsage.keySet())), duplicateCredentials));
        log.info("Validated workflow name={} nodes={} valid={} errors={} warnings={}",
                graph.name(), graph.nodes().size(), report.isValid(), issues.size(), warnings.size());
        return report;
    }

    private boolean checkNodeType(WorkflowNode node, List<ValidationIssue> issues) {
        if (!node.hasType()) {
            issues.add(ValidationIssue.error(node.id(), node.name(), IssueKind.INVALID_NODE_TYPE,
                    "Node has no type specified", null));
            return false;
        }
        if (catalog.isValid(node.type())) {
            return true;
        }
        String suggestion = NodeTypeSuggestions.suggest(node.type(), node.name())
                .map(type -> "Use " + type + " instead")
                .orElse(null);
        issues.add(ValidationIssue.error(node.id(), node.name(), IssueKind.INVALID_NODE_TYPE,
                "Invalid node type: " + node.type(), suggestion));
        return false;
    }

    /** A node named like an email step whose type is not an email type. */
    private Optional<ValidationIssue> checkNaming(WorkflowNode node) {
        if (!node.hasType()) {
            return Optional.empty();
        }
        String name = node.name().toLowerCase(Locale.ROOT);
        String type = node.type().toLowerCase(Locale.ROOT);
        if ((name.contains("email") || name.contains("send")) && !type.contains("email") && !type.contains("send")) {
            return Optional.of(ValidationIssue.warning(node.id(), node.name(), IssueKind.INVALID_NODE_TYPE,
                    "Node named \"" + node.name() + "\" but type is " + node.type(),
                    "Node name and type should match"));
        }
        return Optional.empty();
    }

    private void checkDuplicateNames(WorkflowGraph graph, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (WorkflowNode node : graph.nodes()) {
            if (!seen.add(node.name()) && reported.add(node.name())) {
                issues.add(ValidationIssue.error(node.id(), node.name(), IssueKind.DUPLICATE_NODE_NAME,
                        "Node name \"" + node.name() + "\" is used by more than one node",
                        "Give every node a unique name"));
            }
        }
    }

    private void checkConnections(WorkflowGraph graph, List<ValidationIssue> issues) {
        Set<String> names = graph.nodeNames();
        Map<String, WorkflowNode> byName = new HashMap<>();
        graph.nodes().forEach(n -> byName.putIfAbsent(n.name(), n));
        ConnectionMap connections = graph.connections();

        for (String source : connections.sourcesWithTargets()) {
            if (!names.contains(source)) {
                issues.add(ValidationIssue.error(null, source, IssueKind.INVALID_CONNECTION,
                        "Connection source \"" + source + "\" does not exist",
                        "Remove the connection or add the missing node"));
            }
        }
        Set<String> reported = new LinkedHashSet<>();
        connections.edges().forEach(edge -> {
            String target = edge.target().node();
            if (!names.contains(target)) {
                if (reported.add(edge.source() + "->" + target)) {
                    issues.add(ValidationIssue.error(null, target, IssueKind.INVALID_CONNECTION,
                            "Connection from \"" + edge.source() + "\" targets missing node \"" + target + "\"",
                            "Remove the connection or add the missing node"));
                }
            } else if (NodeTypes.isTrigger(byName.get(target))) {
                issues.add(triggerEdgeIssue(edge, byName.get(target)));
            }
        });
    }

    private static ValidationIssue triggerEdgeIssue(Edge edge, WorkflowNode trigger) {
        return ValidationIssue.error(trigger.id(), trigger.name(), IssueKind.INVALID_CONNECTION,
                "Trigger node \"" + trigger.name() + "\" has an incoming connection from \"" + edge.source() + "\"",
                "Trigger nodes start the workflow and cannot receive connections");
    }

    /**
     * Non-root nodes must be reachable from a root. Triggers need an outgoing edge, and so does a root of a
     * trigger-less graph that has no incoming edge either.
     */
    private void checkDisconnected(WorkflowGraph graph, List<ValidationIssue> issues) {
        if (graph.nodes().size() <= 1) {
            return;
        }
        Set<String> roots = GraphReachability.roots(graph);
        Set<String> reachable = GraphReachability.reachable(graph);
        Set<String> withIncoming = graph.connections().targetNames();
        ConnectionMap connections = graph.connections();
        for (WorkflowNode node : graph.nodes()) {
            boolean disconnected;
            if (NodeTypes.isTrigger(node)) {
                disconnected = !connections.hasOutgoing(node.name());
            } else if (roots.contains(node.name())) {
                disconnected = !withIncoming.contains(node.name()) && !connections.hasOutgoing(node.name());
            } else {
                disconnected = !reachable.contains(node.name());
            }
            if (disconnected) {
                issues.add(ValidationIssue.error(node.id(), node.name(), IssueKind.DISCONNECTED_NODE,
                        "Node \"" + node.name() + "\" is not connected to the workflow",
                        "Connect this node to other nodes in the workflow"));
            }
        }
    }

    private List<ValidationIssue> detectAntiPatterns(WorkflowGraph graph, Map<String, Integer> byType) {
        List<ValidationIssue> warnings = new ArrayList<>();
        for (String type : HIGH_COST_TYPES) {
            int count = byType.getOrDefault(type, 0);
            if (count > thresholds.highCostNodes()) {
                warnings.add(ValidationIssue.warning(PATTERN_REF, "Workflow Pattern", IssueKind.EXCESSIVE_NODE_TYPE,
                        "Excessive " + type + " usage (" + count + " nodes)",
                        "Consider using HTTP Request for simple logging/recording operations"));
            }
        }
        if (graph.nodes().size() > thresholds.largeGraphNodes() && byType.getOrDefault(NodeTypes.ERROR_TRIGGER, 0) == 0) {
            warnings.add(ValidationIssue.warning(PATTERN_REF, "Workflow Pattern", IssueKind.MISSING_ERROR_HANDLING,
                    "Complex workflow without error handling",
                    "Add Error Trigger node for better error management"));
        }
        int decisions = byType.entrySet().stream()
                .filter(e -> NodeTypes.isDecision(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .sum();
        if (decisions > thresholds.decisionNodes() && byType.getOrDefault(NodeTypes.MERGE, 0) == 0) {
            warnings.add(ValidationIssue.warning(PATTERN_REF, "Workflow Pattern", IssueKind.BRANCHING_WITHOUT_MERGE,
                    "Multiple branches without merge nodes",
                    "Use Merge nodes to combine results from parallel branches"));
        }
        return warnings;
    }
}
