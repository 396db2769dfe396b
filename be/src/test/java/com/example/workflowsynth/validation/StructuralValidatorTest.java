package com.example.workflowsynth.validation;

import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Position;
import com.example.workflowsynth.domain.TargetReference;
import com.example.workflowsynth.domain.WorkflowGraph;
import com.example.workflowsynth.domain.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructuralValidator")
class StructuralValidatorTest {

    private final StructuralValidator validator =
            new StructuralValidator(NodeTypeCatalog.standard(), ValidationThresholds.DEFAULTS);

    private static WorkflowGraph graph(List<WorkflowNode> nodes, ConnectionMap connections) {
        return new WorkflowGraph("Test", nodes, connections, Map.of());
    }

    private static ConnectionMap chain(List<WorkflowNode> nodes) {
        ConnectionMap connections = ConnectionMap.empty();
        for (int i = 1; i < nodes.size(); i++) {
            connections.add(nodes.get(i - 1).name(), 0, TargetReference.main(nodes.get(i).name()));
        }
        return connections;
    }

    private static WorkflowNode withCredential(String name, String type, String credentialType) {
        return new WorkflowNode(name, name, type, 1, Position.ORIGIN, Map.of(), Map.of(credentialType, Map.of("id", "1")));
    }

    @Test
    @DisplayName("a clean linear workflow is valid and counted by type")
    void cleanWorkflow() {
        List<WorkflowNode> nodes = List.of(
                WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 200, 0),
                WorkflowNode.of("Shape", NodeTypes.SET, 400, 0));

        ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).isEmpty();
        assertThat(report.nodeStats().total()).isEqualTo(3);
        assertThat(report.nodeStats().valid()).isEqualTo(3);
        assertThat(report.nodeStats().byType()).containsEntry(NodeTypes.SET, 1).hasSize(3);
    }

    @Nested
    @DisplayName("node types")
    class NodeTypeChecks {

        @Test
        @DisplayName("an unknown type is an error with a suggested replacement")
        void invalidTypeWithSuggestion() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Notify Customer", "sendEmail", 200, 0));

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.isValid()).isFalse();
            assertThat(report.issuesOfKind(IssueKind.INVALID_NODE_TYPE)).singleElement().satisfies(issue -> {
                assertThat(issue.message()).isEqualTo("Invalid node type: sendEmail");
                assertThat(issue.suggestion()).isEqualTo("Use n8n-nodes-base.emailSend instead");
                assertThat(issue.severity()).isEqualTo(Severity.ERROR);
            });
            assertThat(report.nodeStats().invalid()).isEqualTo(1);
            assertThat(report.nodeStats().byType()).doesNotContainKey("sendEmail");
        }

        @Test
        @DisplayName("a node without type is an error")
        void missingType() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Mystery", null, 200, 0));

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.issues()).extracting(ValidationIssue::message)
                    .containsExactly("Node has no type specified");
        }

        @Test
        @DisplayName("an email-sounding node with a non-email type is only a warning")
        void namingMismatch() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Send Email", NodeTypes.HTTP_REQUEST, 200, 0));

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.isValid()).isTrue();
            assertThat(report.warningsOfKind(IssueKind.INVALID_NODE_TYPE)).singleElement()
                    .extracting(ValidationIssue::nodeName).isEqualTo("Send Email");
        }
    }

    @Nested
    @DisplayName("connections")
    class Connections {

        @Test
        @DisplayName("a node nothing reaches is disconnected")
        void disconnectedNode() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 200, 0),
                    WorkflowNode.of("Stray", NodeTypes.SET, 200, 200));
            ConnectionMap connections = ConnectionMap.empty();
            connections.add("Start", 0, TargetReference.main("Fetch"));

            ValidationReport report = validator.validate(graph(nodes, connections));

            assertThat(report.issuesOfKind(IssueKind.DISCONNECTED_NODE)).extracting(ValidationIssue::nodeName)
                    .containsExactly("Stray");
        }

        @Test
        @DisplayName("a trigger without outgoing edges is disconnected")
        void idleTrigger() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Later", NodeTypes.SCHEDULE_TRIGGER, 0, 200),
                    WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 200, 0));
            ConnectionMap connections = ConnectionMap.empty();
            connections.add("Start", 0, TargetReference.main("Fetch"));

            ValidationReport report = validator.validate(graph(nodes, connections));

            assertThat(report.issuesOfKind(IssueKind.DISCONNECTED_NODE)).extracting(ValidationIssue::nodeName)
                    .containsExactly("Later");
        }

        @Test
        @DisplayName("a single node is never reported as disconnected")
        void singleNode() {
            ValidationReport report = validator.validate(
                    graph(List.of(WorkflowNode.of("Only", NodeTypes.SET, 0, 0)), ConnectionMap.empty()));

            assertThat(report.isValid()).isTrue();
        }

        @Test
        @DisplayName("connections to missing nodes are reported once per source and target")
        void danglingTarget() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 200, 0));
            ConnectionMap connections = chain(nodes);
            connections.add("Fetch", 0, TargetReference.main("Ghost"));
            connections.add("Fetch", 1, TargetReference.main("Ghost"));
            connections.add("Phantom", 0, TargetReference.main("Fetch"));

            ValidationReport report = validator.validate(graph(nodes, connections));

            assertThat(report.issuesOfKind(IssueKind.INVALID_CONNECTION)).extracting(ValidationIssue::nodeName)
                    .containsExactly("Phantom", "Ghost");
        }

        @Test
        @DisplayName("an edge into a trigger is invalid")
        void edgeIntoTrigger() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    WorkflowNode.of("Fetch", NodeTypes.HTTP_REQUEST, 200, 0));
            ConnectionMap connections = chain(nodes);
            connections.add("Fetch", 0, TargetReference.main("Start"));

            ValidationReport report = validator.validate(graph(nodes, connections));

            assertThat(report.issuesOfKind(IssueKind.INVALID_CONNECTION)).singleElement()
                    .extracting(ValidationIssue::nodeName).isEqualTo("Start");
        }

        @Test
        @DisplayName("duplicate names are reported once")
        void duplicateNames() {
            List<WorkflowNode> nodes = List.of(
                    WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0),
                    new WorkflowNode("a", "Step", NodeTypes.SET, 1, new Position(200, 0), Map.of(), Map.of()),
                    new WorkflowNode("b", "Step", NodeTypes.SET, 1, new Position(400, 0), Map.of(), Map.of()),
                    new WorkflowNode("c", "Step", NodeTypes.SET, 1, new Position(600, 0), Map.of(), Map.of()));
            ConnectionMap connections = ConnectionMap.empty();
            connections.add("Start", 0, TargetReference.main("Step"));

            ValidationReport report = validator.validate(graph(nodes, connections));

            assertThat(report.issuesOfKind(IssueKind.DUPLICATE_NODE_NAME)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("anti-patterns")
    class AntiPatterns {

        @Test
        @DisplayName("a large branching chain without error trigger or merge gets exactly two warnings")
        void largeBranchingWorkflow() {
            List<WorkflowNode> nodes = new ArrayList<>();
            nodes.add(WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0));
            for (int i = 1; i < 25; i++) {
                String type = i <= 4 ? NodeTypes.IF : NodeTypes.SET;
                nodes.add(WorkflowNode.of("Step " + i, type, i * 200, 0));
            }

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.isValid()).isTrue();
            assertThat(report.warnings()).extracting(ValidationIssue::kind)
                    .containsExactlyInAnyOrder(IssueKind.MISSING_ERROR_HANDLING, IssueKind.BRANCHING_WITHOUT_MERGE);
        }

        @Test
        @DisplayName("too many database nodes of one type are flagged")
        void excessiveDatabaseNodes() {
            List<WorkflowNode> nodes = new ArrayList<>();
            nodes.add(WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0));
            for (int i = 1; i <= 6; i++) {
                nodes.add(WorkflowNode.of("Query " + i, NodeTypes.POSTGRES, i * 200, 0));
            }

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.warningsOfKind(IssueKind.EXCESSIVE_NODE_TYPE)).singleElement()
                    .extracting(ValidationIssue::message)
                    .isEqualTo("Excessive n8n-nodes-base.postgres usage (6 nodes)");
        }

        @Test
        @DisplayName("reusing one credential type beyond the threshold is flagged")
        void credentialReuse() {
            List<WorkflowNode> nodes = new ArrayList<>();
            nodes.add(WorkflowNode.of("Start", NodeTypes.WEBHOOK, 0, 0));
            for (int i = 1; i <= 4; i++) {
                nodes.add(withCredential("Call " + i, NodeTypes.HTTP_REQUEST, "httpHeaderAuth"));
            }
            nodes.add(withCredential("Chat", NodeTypes.PREFIX + "slack", "slackApi"));

            ValidationReport report = validator.validate(graph(nodes, chain(nodes)));

            assertThat(report.warningsOfKind(IssueKind.DUPLICATE_CREDENTIAL)).hasSize(1);
            assertThat(report.credentialStats().duplicates()).containsExactly("httpHeaderAuth");
            assertThat(report.credentialStats().required()).containsExactly("httpHeaderAuth", "slackApi");
        }
    }
}
