package com.example.workflowsynth;

import com.example.workflowsynth.assembly.GraphAssembler;
import com.example.workflowsynth.llm.StubChatModel;
import com.example.workflowsynth.service.WorkflowSynthesisService;
import com.example.workflowsynth.synthesis.SynthesisResult;

import dev.langchain4j.model.chat.ChatModel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(WorkflowSynthApplicationTest.StubModelConfig.class)
@DisplayName("Application context")
class WorkflowSynthApplicationTest {

    private static final String PLAN = """
            { "mainTrigger": { "type": "manual" },
              "branches": [ { "name": "Collect" }, { "name": "Report" } ],
              "mergePoints": [ { "name": "Join Results", "mergesBranches": ["Collect", "Report"] } ] }""";

    private static final String FRAGMENT = """
            { "nodes": [
                { "name": "%1$s Load", "type": "n8n-nodes-base.httpRequest", "position": [0, 0] },
                { "name": "%1$s Shape", "type": "n8n-nodes-base.set", "position": [200, 0] } ] }""";

    @TestConfiguration
    static class StubModelConfig {
        @Bean
        @Primary
        ChatModel stubChatModel() {
            return new StubChatModel(prompt -> prompt.startsWith("Analyze this workflow request")
                    ? PLAN
                    : FRAGMENT.formatted(prompt.contains("\"Collect\"") ? "Collect" : "Report"));
        }
    }

    @Autowired
    private WorkflowSynthesisService service;

    @Test
    @DisplayName("generates a merged workflow end to end with the wired beans")
    void synthesizesWithStubModel() {
        SynthesisResult result = service.synthesize("Daily digest", "collect numbers and report them");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> nodes = (List<Map<String, Object>>) result.workflow().get("nodes");
        assertThat(nodes).extracting(n -> n.get("name")).containsExactly(
                GraphAssembler.TRIGGER_NAME, "Collect Load", "Collect Shape", "Report Load", "Report Shape",
                "Join Results");
        assertThat(result.entryNodes()).containsExactly("Collect Load", "Report Load");
        assertThat(result.unresolvedOrphans()).isEmpty();
        assertThat(result.report().isValid()).isTrue();
    }
}
