package com.example.workflowsynth.normalize;

import com.example.workflowsynth.codec.WorkflowJsonCodec;
import com.example.workflowsynth.domain.ConnectionMap;
import com.example.workflowsynth.domain.Ports;
import com.example.workflowsynth.domain.TargetReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConnectionNormalizer")
class ConnectionNormalizerTest {

    private static Map<String, Object> ref(String node, int index) {
        return Map.of("node", node, "type", "main", "index", index);
    }

    @Nested
    @DisplayName("canonical input")
    class Canonical {

        @Test
        @DisplayName("normalizing an already canonical map returns it unchanged")
        void idempotent() {
            Map<String, Object> raw = Map.of(
                    "Fetch", Map.of("main", List.of(List.of(ref("Transform", 0)))),
                    "Check", Map.of("main", List.of(List.of(ref("Accept", 0)), List.of(ref("Reject", 0), ref("Audit", 1)))));

            ConnectionMap once = ConnectionNormalizer.normalize(raw);
            ConnectionMap twice = ConnectionNormalizer.normalize(WorkflowJsonCodec.connectionsToJson(once));

            assertThat(twice).isEqualTo(once);
            assertThat(WorkflowJsonCodec.connectionsToJson(twice)).isEqualTo(WorkflowJsonCodec.connectionsToJson(once));
        }

        @Test
        @DisplayName("keeps an empty port list and repeated targets as given")
        void keepsEmptyMainAndRepeats() {
            Map<String, Object> raw = Map.of(
                    "Idle", Map.of("main", List.of()),
                    "Fan", Map.of("main", List.of(List.of(ref("Next", 0), ref("Next", 0)))));

            ConnectionMap map = ConnectionNormalizer.normalize(raw);

            assertThat(map.sources()).contains("Idle");
            assertThat(map.ports("Idle")).isEmpty();
            assertThat(map.targets("Fan", Ports.SUCCESS))
                    .containsExactly(TargetReference.main("Next"), TargetReference.main("Next"));
            assertThat(WorkflowJsonCodec.connectionsToJson(map)).isEqualTo(raw);
        }

        @Test
        @DisplayName("keeps ports and input indexes")
        void keepsPortsAndIndexes() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "Check", Map.of("main", List.of(List.of(ref("Accept", 0)), List.of(ref("Merge", 1))))));

            assertThat(map.targets("Check", Ports.SUCCESS)).containsExactly(TargetReference.main("Accept"));
            assertThat(map.targets("Check", Ports.ERROR)).containsExactly(new TargetReference("Merge", "main", 1));
        }

        @Test
        @DisplayName("keeps an empty success port when only the error port is wired")
        void keepsEmptyPort() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "Call API", Map.of("main", List.of(List.of(), List.of(ref("Handle Error", 0))))));

            assertThat(map.ports("Call API")).hasSize(2);
            assertThat(map.targets("Call API", Ports.SUCCESS)).isEmpty();
            assertThat(map.targets("Call API", Ports.ERROR)).containsExactly(TargetReference.main("Handle Error"));
        }
    }

    @Nested
    @DisplayName("loose input")
    class Loose {

        @Test
        @DisplayName("string targets become main/0 references")
        void stringTargets() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "A", Map.of("main", List.of(List.of("B", "C")))));

            assertThat(map.targets("A", 0)).containsExactly(TargetReference.main("B"), TargetReference.main("C"));
        }

        @Test
        @DisplayName("partial objects get default type and index")
        void partialObjects() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "A", Map.of("main", List.of(List.of(Map.of("node", "B"), Map.of("node", "C", "index", "2"))))));

            assertThat(map.targets("A", 0)).containsExactly(
                    TargetReference.main("B"), new TargetReference("C", "main", 2));
        }

        @Test
        @DisplayName("flat main list, bare list, single object and bare name all land on port 0")
        void flatShapes() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "A", Map.of("main", List.of("B")),
                    "B", List.of(Map.of("node", "C")),
                    "C", Map.of("node", "D"),
                    "D", "E"));

            assertThat(map.targets("A", 0)).containsExactly(TargetReference.main("B"));
            assertThat(map.targets("B", 0)).containsExactly(TargetReference.main("C"));
            assertThat(map.targets("C", 0)).containsExactly(TargetReference.main("D"));
            assertThat(map.targets("D", 0)).containsExactly(TargetReference.main("E"));
        }

        @Test
        @DisplayName("keeps targets naming nodes that do not exist")
        void keepsDanglingTargets() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of("A", "Ghost"));

            assertThat(map.targetNames()).containsExactly("Ghost");
        }

        @Test
        @DisplayName("skips unrecognized records and unusable targets")
        void skipsGarbage() {
            ConnectionMap map = ConnectionNormalizer.normalize(Map.of(
                    "A", 42,
                    "B", Map.of("other", "x"),
                    "C", Map.of("main", List.of(List.of(7, Map.of("type", "main"), "D")))));

            assertThat(map.sources()).containsExactly("C");
            assertThat(map.targets("C", 0)).containsExactly(TargetReference.main("D"));
        }

        @Test
        @DisplayName("null input gives an empty map")
        void nullInput() {
            assertThat(ConnectionNormalizer.normalize(null).isEmpty()).isTrue();
        }
    }
}
