package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.assembly.MergePoint;
import com.example.workflowsynth.assembly.TriggerType;
import com.example.workflowsynth.llm.StubChatModel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowPlanner")
class WorkflowPlannerTest {

    private static final String PROMPT = "When an order arrives, charge the card and email a receipt";
    private static final String PLAIN_PROMPT = "Copy new rows into the archive sheet";

    private static final String PLAN_REPLY = """
            ```json
            {
              "mainTrigger": { "type": "schedule", "description": "every hour" },
              "branches": [
                { "name": "Charge Card", "description": "charge the customer", "parallel": true, "estimatedNodes": 4 },
                { "name": "Email Receipt", "estimatedNodes": "3" },
                { "description": "no name, ignored" }
              ],
              "mergePoints": [ { "name": "Join", "mergesBranches": ["Charge Card", "Email Receipt"] } ]
            }
            ```""";

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    @DisplayName("reads branches, trigger and merge points from the model reply")
    void parsesPlan() {
        StubChatModel model = new StubChatModel(PLAN_REPLY);

        WorkflowPlan plan = new WorkflowPlanner(model, jsonMapper).plan(PROMPT);

        assertThat(plan.mainTrigger().type()).isEqualTo(TriggerType.SCHEDULE);
        assertThat(plan.branches()).extracting(BranchPlan::name).containsExactly("Charge Card", "Email Receipt");
        assertThat(plan.branches().get(0).parallel()).isTrue();
        assertThat(plan.branches().get(1).estimatedNodes()).isEqualTo(3);
        assertThat(plan.branches().get(1).description()).isEqualTo(PROMPT);
        assertThat(plan.mergePoints()).containsExactly(new MergePoint("Join", List.of("Charge Card", "Email Receipt")));
        assertThat(model.prompts()).singleElement().asString().contains(PROMPT);
    }

    @Nested
    @DisplayName("fallback")
    class Fallback {

        @Test
        @DisplayName("a reply without branches yields the keyword plan")
        void noBranches() {
            WorkflowPlan plan = new WorkflowPlanner(new StubChatModel("{\"branches\": []}"), jsonMapper).plan(PLAIN_PROMPT);

            assertThat(plan.branches()).singleElement().satisfies(branch -> {
                assertThat(branch.name()).isEqualTo(KeywordPlans.CORE_BRANCH);
                assertThat(branch.description()).isEqualTo(PLAIN_PROMPT);
                assertThat(branch.estimatedNodes()).isEqualTo(5);
            });
            assertThat(plan.mainTrigger().type()).isEqualTo(TriggerType.WEBHOOK);
            assertThat(plan.mergePoints()).isEmpty();
        }

        @Test
        @DisplayName("prose and broken JSON yield the keyword plan")
        void garbage() {
            assertThat(new WorkflowPlanner(new StubChatModel("I would split this into two parts."), jsonMapper)
                    .plan(PLAIN_PROMPT).branches()).hasSize(1);
            assertThat(new WorkflowPlanner(new StubChatModel("{ \"branches\": [ }"), jsonMapper)
                    .plan(PROMPT).branches()).extracting(BranchPlan::name)
                    .containsExactly(KeywordPlans.CORE_BRANCH, "Notifications");
        }

        @Test
        @DisplayName("a failing model call yields the keyword plan")
        void modelFailure() {
            StubChatModel failing = new StubChatModel(prompt -> {
                throw new IllegalStateException("rate limited");
            });

            WorkflowPlan plan = new WorkflowPlanner(failing, jsonMapper).plan(PLAIN_PROMPT);

            assertThat(plan.branches()).extracting(BranchPlan::name).containsExactly(KeywordPlans.CORE_BRANCH);
        }
    }

    @Nested
    @DisplayName("keyword plan")
    class Keywords {

        @Test
        @DisplayName("each mentioned feature area becomes a parallel branch sized by the feature count")
        void featureBranches() {
            String prompt = "Call the payments API, run validation on the payload and email a report with logging";

            WorkflowPlan plan = KeywordPlans.plan(prompt);

            assertThat(KeywordPlans.features(prompt)).containsExactly("api", "email", "validation", "logging", "report");
            assertThat(plan.branches()).extracting(BranchPlan::name).containsExactly(
                    KeywordPlans.CORE_BRANCH, "Input Validation", "External Integrations", "Notifications",
                    "Monitoring & Logging");
            assertThat(plan.branches()).extracting(BranchPlan::estimatedNodes).containsExactly(9, 6, 6, 6, 3);
            assertThat(plan.branches()).extracting(BranchPlan::parallel).containsExactly(false, true, true, true, true);
            assertThat(plan.branches().get(1).description()).endsWith(prompt);
            assertThat(plan.mainTrigger().type()).isEqualTo(TriggerType.WEBHOOK);
        }

        @Test
        @DisplayName("a scheduling request starts from a schedule trigger")
        void scheduling() {
            WorkflowPlan plan = KeywordPlans.plan("Nightly scheduling of the retry queue");

            assertThat(plan.mainTrigger().type()).isEqualTo(TriggerType.SCHEDULE);
            assertThat(plan.branches()).extracting(BranchPlan::name)
                    .containsExactly(KeywordPlans.CORE_BRANCH, "Error Handling");
        }
    }
}
