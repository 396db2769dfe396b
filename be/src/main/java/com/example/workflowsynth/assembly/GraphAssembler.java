package com.example.workflowsynth.assembly;

import com.example.workflowsynth.codec.WorkflowJsonCodec;
import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.GraphInvariantViolationException;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Ports;
import com.example.workflowsynth.domain.Position;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.fragment.ParameterDefaults;
import com.example.workflowsynth.fragment.RepairedFragment;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.IssueKind;
import com.example.workflowsynth.validation.ValidationIssue;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines a synthetic trigger, the repaired fragments and the declared merge nodes into one graph.
 * <p>
 * Layout: fragments share the horizontal base {@link #FRAGMENT_BASE_X} and are stacked in vertical bands that
 * never overlap, so positions from different fragments cannot collide. A fragment keeps its internal relative
 * layout unless two of its nodes share a position, in which case it is laid out as a single row.
 * </p>
 */
@Slf4j
public class GraphAssembler {

    public static final String TRIGGER_NAME = "Main Trigger";
    public static final String TRIGGER_ID = "main_trigger";

    static final Position TRIGGER_POSITION = new Position(250, 500);
    static final double FRAGMENT_BASE_X = 450;
    static final double FIRST_BAND_Y = 100;
    static final double BAND_GAP = 200;
    static final double ROW_SPACING = 200;
    static final double MERGE_OFFSET_X = 300;
    static final double MERGE_BASE_Y = 500;
    static final double MERGE_SPACING_Y = 200;

    private static final Map<String, Object> DEFAULT_SETTINGS = Map.of("executionOrder", "v1");

    public AssembledGraph assemble(String workflowName, TriggerType triggerType, List<RepairedFragment> fragments,
                                   List<MergePoint> mergePoints) {
        String name = workflowName != null && !workflowName.isBlank() ? workflowName : WorkflowJsonCodec.DEFAULT_NAME;
        TriggerType trigger = triggerType != null ? triggerType : TriggerType.WEBHOOK;

        List<WorkflowNode> nodes = new ArrayList<>();
        ConnectionMap connections = ConnectionMap.empty();
        Map<String, String> fragmentByNode = new LinkedHashMap<>();
        List<FragmentPlacement> placements = new ArrayList<>();
        List<RepairAction> actions = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        Set<String> takenNames = new HashSet<>();
        Set<String> takenIds = new HashSet<>();

        WorkflowNode triggerNode = triggerNode(trigger);
        nodes.add(triggerNode);
        takenNames.add(triggerNode.name());
        takenIds.add(triggerNode.id());

        double bandTop = FIRST_BAND_Y;
        for (RepairedFragment fragment : fragments) {
            actions.addAll(fragment.actions());
            warnings.addAll(fragment.warnings());
            if (fragment.isEmpty()) {
                log.warn("Skipping empty fragment fragment={}", fragment.name());
                warnings.add(ValidationIssue.warning(fragment.prefix(), fragment.name(), IssueKind.EMPTY_FRAGMENT,
                        "Fragment \"" + fragment.name() + "\" has no nodes and was skipped",
                        "Regenerate the fragment"));
                actions.add(RepairAction.note(RepairAction.Kind.FRAGMENT_SKIPPED, fragment.name(), "empty fragment"));
                continue;
            }

            Map<String, String> renames = collisionRenames(fragment, takenNames, actions);
            List<WorkflowNode> placed = layout(fragment.nodes(), bandTop);
            bandTop += bandHeight(placed) + BAND_GAP;

            List<String> nodeNames = new ArrayList<>();
            for (WorkflowNode node : placed) {
                String nodeName = renames.getOrDefault(node.name(), node.name());
                String id = node.id();
                if (!takenIds.add(id)) {
                    id = freeName(id + "_" + (placements.size() + 1), "_", takenIds);
                    takenIds.add(id);
                }
                nodes.add(node.withName(nodeName).withId(id));
                takenNames.add(nodeName);
                fragmentByNode.put(nodeName, fragment.name());
                nodeNames.add(nodeName);
            }
            connections.putAll(fragment.connections().renamed(n -> renames.getOrDefault(n, n)));

            String entry = renames.getOrDefault(fragment.entry(), fragment.entry());
            List<String> exits = fragment.exits().stream().map(n -> renames.getOrDefault(n, n)).toList();
            placements.add(new FragmentPlacement(fragment.name(), fragment.prefix(), entry, exits, nodeNames));
        }

        fanOut(triggerNode.name(), placements, nodes, connections, actions);
        List<MergeBinding> mergeBindings = placeMergeNodes(mergePoints, nodes, takenNames, takenIds);

        WorkflowGraph graph = new WorkflowGraph(name, nodes, connections, DEFAULT_SETTINGS);
        requireUniqueNames(graph);
        log.info("Assembled workflow name={} fragments={} nodes={} mergeNodes={}",
                name, placements.size(), nodes.size(), mergeBindings.size());
        return new AssembledGraph(graph, triggerNode.name(), fragmentByNode, placements, mergeBindings,
                actions, warnings);
    }

    private WorkflowNode triggerNode(TriggerType trigger) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (trigger == TriggerType.WEBHOOK) {
            parameters.put("httpMethod", "POST");
            parameters.put("path", "workflow-trigger");
            parameters.put("responseMode", "lastNode");
        } else if (trigger == TriggerType.SCHEDULE) {
            parameters.put("rule", Map.of("interval", List.of(Map.of("field", "hours"))));
        }
        return new WorkflowNode(TRIGGER_ID, TRIGGER_NAME, trigger.nodeType(), trigger.typeVersion(),
                TRIGGER_POSITION, parameters, Map.of());
    }

    /**
     * Names of this fragment already used elsewhere become {@code "<name> (<fragment name>)"}, followed by
     * {@code " 2"}, {@code " 3"}... while that is still taken by the graph or by the fragment itself.
     */
    private Map<String, String> collisionRenames(RepairedFragment fragment, Set<String> takenNames,
                                                 List<RepairAction> actions) {
        Map<String, String> renames = new HashMap<>();
        Set<String> reserved = new HashSet<>(takenNames);
        fragment.nodes().forEach(n -> reserved.add(n.name()));
        for (WorkflowNode node : fragment.nodes()) {
            if (takenNames.contains(node.name())) {
                String renamed = freeName(node.name() + " (" + fragment.name() + ")", " ", reserved);
                reserved.add(renamed);
                renames.put(node.name(), renamed);
                actions.add(RepairAction.note(RepairAction.Kind.RENAMED, renamed,
                        "name \"" + node.name() + "\" already used by another fragment"));
                log.debug("Renamed colliding node from={} to={} fragment={}", node.name(), renamed, fragment.name());
            }
        }
        return renames;
    }

    private List<WorkflowNode> layout(List<WorkflowNode> nodes, double bandTop) {
        List<WorkflowNode> placed = new ArrayList<>(nodes.size());
        if (hasDuplicatePositions(nodes)) {
            for (int i = 0; i < nodes.size(); i++) {
                placed.add(nodes.get(i).withPosition(new Position(FRAGMENT_BASE_X + i * ROW_SPACING, bandTop)));
            }
            return placed;
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        for (WorkflowNode node : nodes) {
            minX = Math.min(minX, node.position().x());
            minY = Math.min(minY, node.position().y());
        }
        double dx = FRAGMENT_BASE_X - minX;
        double dy = bandTop - minY;
        for (WorkflowNode node : nodes) {
            placed.add(node.withPosition(node.position().translate(dx, dy)));
        }
        return placed;
    }

    private static boolean hasDuplicatePositions(List<WorkflowNode> nodes) {
        Set<Position> seen = new HashSet<>();
        for (WorkflowNode node : nodes) {
            if (!seen.add(node.position())) {
                return true;
            }
        }
        return false;
    }

    private static double bandHeight(List<WorkflowNode> placed) {
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (WorkflowNode node : placed) {
            minY = Math.min(minY, node.position().y());
            maxY = Math.max(maxY, node.position().y());
        }
        return maxY - minY;
    }

    /** One target group on the trigger's success port holding every fragment entry in fragment order. */
    private void fanOut(String triggerName, List<FragmentPlacement> placements, List<WorkflowNode> nodes,
                        ConnectionMap connections, List<RepairAction> actions) {
        Map<String, WorkflowNode> byName = new HashMap<>();
        nodes.forEach(n -> byName.put(n.name(), n));
        for (FragmentPlacement placement : placements) {
            WorkflowNode entry = byName.get(placement.entry());
            if (entry == null || NodeTypes.isTrigger(entry)) {
                log.debug("Not fanning into fragment={} entry={}", placement.name(), placement.entry());
                continue;
            }
            connections.add(triggerName, Ports.SUCCESS, TargetReference.main(entry.name()));
            actions.add(RepairAction.edge(RepairAction.Kind.FANNED_OUT, triggerName, Ports.SUCCESS, entry.name(),
                    "entry of fragment " + placement.name()));
        }
    }

    private List<MergeBinding> placeMergeNodes(List<MergePoint> mergePoints, List<WorkflowNode> nodes,
                                               Set<String> takenNames, Set<String> takenIds) {
        if (mergePoints == null || mergePoints.isEmpty()) {
            return List.of();
        }
        double maxX = nodes.stream().mapToDouble(n -> n.position().x()).max().orElse(FRAGMENT_BASE_X);
        List<MergeBinding> bindings = new ArrayList<>();
        for (int j = 0; j < mergePoints.size(); j++) {
            MergePoint point = mergePoints.get(j);
            String mergeName = point.name() != null && !point.name().isBlank() ? point.name().trim() : "Merge " + (j + 1);
            if (takenNames.contains(mergeName)) {
                mergeName = freeName(mergeName + " (merge " + (j + 1) + ")", " ", takenNames);
            }
            String id = freeName("merge_" + j, "_", takenIds);
            takenIds.add(id);
            Position position = new Position(maxX + MERGE_OFFSET_X, MERGE_BASE_Y + j * MERGE_SPACING_Y);
            WorkflowNode merge = ParameterDefaults.apply(
                    new WorkflowNode(id, mergeName, NodeTypes.MERGE, 3, position, Map.of(), Map.of()));
            nodes.add(merge);
            takenNames.add(mergeName);
            bindings.add(new MergeBinding(mergeName, point.mergesFragments()));
        }
        return bindings;
    }

    /** {@code base}, or the first of {@code base<separator>2}, {@code base<separator>3}... not in {@code taken}. */
    static String freeName(String base, String separator, Set<String> taken) {
        String candidate = base;
        for (int n = 2; taken.contains(candidate); n++) {
            candidate = base + separator + n;
        }
        return candidate;
    }

    private static void requireUniqueNames(WorkflowGraph graph) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            if (!seen.add(node.name())) {
                duplicates.add(node.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new GraphInvariantViolationException("Assembled graph has duplicate node names", duplicates);
        }
    }
}
