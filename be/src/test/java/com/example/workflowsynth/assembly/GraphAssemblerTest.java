package com.example.workflowsynth.assembly;

import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Position;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;
import com.example.workflowsynth.fragment.FragmentDraft;
import com.example.workflowsynth.fragment.FragmentRepairer;
import com.example.workflowsynth.fragment.RepairedFragment;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.IssueKind;
import com.example.workflowsynth.validation.ValidationIssue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GraphAssembler")
class GraphAssemblerTest {

    private final FragmentRepairer repairer = new FragmentRepairer();
    private final GraphAssembler assembler = new GraphAssembler();

    private RepairedFragment fragment(String name, WorkflowNode... nodes) {
        return repairer.repair(new FragmentDraft(name, List.of(nodes), Map.of(), null, List.of(), List.of(), List.of()));
    }

    private RepairedFragment fetchFragment() {
        return fragment("Fetch Data",
                WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 250, 300),
                WorkflowNode.of("Transform", NodeTypes.SET, 450, 300));
    }

    private RepairedFragment validateFragment() {
        return fragment("Check Input",
                WorkflowNode.of("Validate", NodeTypes.CODE, 250, 300),
                WorkflowNode.of("Notify", NodeTypes.HTTP_REQUEST, 450, 300));
    }

    @Nested
    @DisplayName("trigger fan-out")
    class FanOut {

        @Test
        @DisplayName("the trigger feeds every fragment entry from a single group on port 0")
        void singleGroup() {
            AssembledGraph assembled = assembler.assemble("Orders", TriggerType.WEBHOOK,
                    List.of(fetchFragment(), validateFragment()), List.of());
            WorkflowGraph graph = assembled.graph();

            assertThat(graph.nodes()).hasSize(5);
            assertThat(graph.connections().ports(GraphAssembler.TRIGGER_NAME)).hasSize(1);
            assertThat(graph.connections().targets(GraphAssembler.TRIGGER_NAME, 0))
                    .extracting(TargetReference::node)
                    .containsExactly("Fetch", "Validate");
            assertThat(assembled.entryNodes()).containsExactly("Fetch", "Validate");
            assertThat(graph.connections().hasEdge("Fetch", "Transform")).isTrue();
            assertThat(graph.connections().hasEdge("Validate", "Notify")).isTrue();
        }

        @Test
        @DisplayName("the trigger node matches the requested trigger type")
        void triggerType() {
            WorkflowGraph webhook = assembler.assemble(null, TriggerType.WEBHOOK, List.of(fetchFragment()), List.of()).graph();
            WorkflowGraph schedule = assembler.assemble(null, TriggerType.SCHEDULE, List.of(fetchFragment()), List.of()).graph();

            assertThat(webhook.node(GraphAssembler.TRIGGER_NAME)).get().satisfies(node -> {
                assertThat(node.type()).isEqualTo(NodeTypes.WEBHOOK);
                assertThat(node.parameters()).containsEntry("httpMethod", "POST");
            });
            assertThat(schedule.node(GraphAssembler.TRIGGER_NAME)).get()
                    .extracting(WorkflowNode::type).isEqualTo(NodeTypes.SCHEDULE_TRIGGER);
            assertThat(webhook.name()).isEqualTo("Untitled Workflow");
            assertThat(webhook.settings()).containsEntry("executionOrder", "v1");
        }

        @Test
        @DisplayName("a fragment whose entry is itself a trigger is not fanned into")
        void triggerEntryNotFanned() {
            RepairedFragment hooks = fragment("Inbound", WorkflowNode.of("Inbound Hook", NodeTypes.WEBHOOK, 0, 0));

            AssembledGraph assembled = assembler.assemble("Hooks", TriggerType.MANUAL, List.of(hooks), List.of());

            assertThat(assembled.graph().connections().hasOutgoing(GraphAssembler.TRIGGER_NAME)).isFalse();
            assertThat(assembled.graph().nodes()).extracting(WorkflowNode::name)
                    .containsExactly(GraphAssembler.TRIGGER_NAME, "Inbound Hook");
        }
    }

    @Nested
    @DisplayName("fragment placement")
    class Placement {

        @Test
        @DisplayName("empty fragments are skipped with a warning")
        void emptySkipped() {
            RepairedFragment empty = repairer.repair(FragmentDraft.empty("Broken", null));

            AssembledGraph assembled = assembler.assemble("Mixed", TriggerType.WEBHOOK,
                    List.of(empty, fetchFragment()), List.of());

            assertThat(assembled.placements()).extracting(FragmentPlacement::name).containsExactly("Fetch Data");
            assertThat(assembled.warnings()).extracting(ValidationIssue::kind).containsExactly(IssueKind.EMPTY_FRAGMENT);
            assertThat(assembled.actions()).extracting(RepairAction::kind).contains(RepairAction.Kind.FRAGMENT_SKIPPED);
            assertThat(assembled.graph().nodes()).hasSize(3);
        }

        @Test
        @DisplayName("a name already used by an earlier fragment gets the fragment name appended")
        void collisionRenamed() {
            RepairedFragment alpha = fragment("Alpha",
                    WorkflowNode.of("Start", NodeTypes.SET, 0, 0),
                    WorkflowNode.of("Log Result", NodeTypes.SET, 200, 0));
            RepairedFragment beta = fragment("Beta",
                    WorkflowNode.of("Begin", NodeTypes.SET, 0, 0),
                    WorkflowNode.of("Log Result", NodeTypes.SET, 200, 0));

            AssembledGraph assembled = assembler.assemble("Logs", TriggerType.WEBHOOK, List.of(alpha, beta), List.of());
            WorkflowGraph graph = assembled.graph();

            assertThat(graph.nodeNames()).contains("Log Result", "Log Result (Beta)");
            assertThat(graph.connections().hasEdge("Begin", "Log Result (Beta)")).isTrue();
            assertThat(graph.connections().hasEdge("Begin", "Log Result")).isFalse();
            assertThat(assembled.placement("Beta")).get()
                    .extracting(FragmentPlacement::exits).isEqualTo(List.of("Log Result (Beta)"));
            assertThat(assembled.fragmentByNode()).containsEntry("Log Result (Beta)", "Beta");
        }

        @Test
        @DisplayName("a suffixed name already held by a node gets a counter instead")
        void suffixedNameTaken() {
            RepairedFragment alpha = fragment("Alpha",
                    WorkflowNode.of("X", NodeTypes.SET, 0, 0),
                    WorkflowNode.of("X (B)", NodeTypes.SET, 200, 0));
            RepairedFragment b = fragment("B", WorkflowNode.of("X", NodeTypes.SET, 0, 0));

            WorkflowGraph graph = assembler.assemble("Clash", TriggerType.WEBHOOK, List.of(alpha, b), List.of()).graph();

            assertThat(graph.nodeNames()).containsExactly(GraphAssembler.TRIGGER_NAME, "X", "X (B)", "X (B) 2");
            assertThat(graph.connections().targets(GraphAssembler.TRIGGER_NAME, 0))
                    .extracting(TargetReference::node).containsExactly("X", "X (B) 2");
        }

        @Test
        @DisplayName("fragments sharing a name and node names still produce unique names and ids")
        void repeatedFragments() {
            RepairedFragment first = fragment("Notify", WorkflowNode.of("Send Email", NodeTypes.EMAIL_SEND, 0, 0));
            RepairedFragment second = fragment("Notify", WorkflowNode.of("Send Email", NodeTypes.EMAIL_SEND, 0, 0));
            RepairedFragment third = fragment("Notify", WorkflowNode.of("Send Email", NodeTypes.EMAIL_SEND, 0, 0));

            WorkflowGraph graph = assembler.assemble("Notify", TriggerType.WEBHOOK,
                    List.of(first, second, third), List.of()).graph();

            assertThat(graph.nodeNames()).containsExactly(GraphAssembler.TRIGGER_NAME,
                    "Send Email", "Send Email (Notify)", "Send Email (Notify) 2");
            assertThat(graph.nodes()).extracting(WorkflowNode::id).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("fragments are stacked in bands so no two nodes share a position")
        void nonOverlapping() {
            AssembledGraph assembled = assembler.assemble("Layout", TriggerType.WEBHOOK,
                    List.of(fetchFragment(), validateFragment()), List.of());
            WorkflowGraph graph = assembled.graph();

            Set<Position> positions = new HashSet<>();
            graph.nodes().forEach(n -> positions.add(n.position()));
            assertThat(positions).hasSize(graph.nodes().size());

            assertThat(graph.node("Fetch")).get().extracting(WorkflowNode::position)
                    .isEqualTo(new Position(GraphAssembler.FRAGMENT_BASE_X, GraphAssembler.FIRST_BAND_Y));
            double validateY = graph.node("Validate").orElseThrow().position().y();
            assertThat(validateY).isGreaterThan(graph.node("Transform").orElseThrow().position().y());
        }

        @Test
        @DisplayName("a fragment with stacked nodes is laid out as a row")
        void duplicatePositionsBecomeRow() {
            RepairedFragment stacked = fragment("Stacked",
                    WorkflowNode.of("One", NodeTypes.SET, 0, 0),
                    WorkflowNode.of("Two", NodeTypes.SET, 0, 0));

            WorkflowGraph graph = assembler.assemble("Row", TriggerType.WEBHOOK, List.of(stacked), List.of()).graph();

            assertThat(graph.node("One")).get().extracting(WorkflowNode::position)
                    .isEqualTo(new Position(450, 100));
            assertThat(graph.node("Two")).get().extracting(WorkflowNode::position)
                    .isEqualTo(new Position(650, 100));
        }
    }

    @Test
    @DisplayName("merge nodes are placed right of every fragment and bound to their fragments")
    void mergeNodes() {
        AssembledGraph assembled = assembler.assemble("Merged", TriggerType.WEBHOOK,
                List.of(fetchFragment(), validateFragment()),
                List.of(new MergePoint("Combine Results", List.of("Fetch Data", "Check Input")),
                        new MergePoint(null, List.of("Fetch Data"))));
        WorkflowGraph graph = assembled.graph();

        double maxFragmentX = 650;
        assertThat(graph.node("Combine Results")).get().satisfies(node -> {
            assertThat(node.type()).isEqualTo(NodeTypes.MERGE);
            assertThat(node.position()).isEqualTo(new Position(maxFragmentX + 300, 500));
            assertThat(node.parameters()).containsEntry("mode", "combine");
        });
        assertThat(graph.node("Merge 2")).get().extracting(WorkflowNode::position)
                .isEqualTo(new Position(maxFragmentX + 300, 700));
        assertThat(assembled.mergeBindings()).extracting(MergeBinding::mergeNode)
                .containsExactly("Combine Results", "Merge 2");
        assertThat(assembled.fragmentByNode()).doesNotContainKey("Combine Results");
    }

    @Test
    @DisplayName("a merge name held by fragment nodes is suffixed until free")
    void mergeNameTaken() {
        RepairedFragment joined = fragment("Joined",
                WorkflowNode.of("Join", NodeTypes.SET, 0, 0),
                WorkflowNode.of("Join (merge 1)", NodeTypes.SET, 200, 0));

        AssembledGraph assembled = assembler.assemble("Joins", TriggerType.WEBHOOK, List.of(joined),
                List.of(new MergePoint("Join", List.of("Joined"))));

        assertThat(assembled.mergeBindings()).extracting(MergeBinding::mergeNode).containsExactly("Join (merge 1) 2");
        assertThat(assembled.graph().node("Join (merge 1) 2")).get()
                .extracting(WorkflowNode::type).isEqualTo(NodeTypes.MERGE);
    }
}
