package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.fragment.FragmentPrefixes;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Generates one fragment per branch with the chat model.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatModelFragmentGenerator implements FragmentGenerator {

    static final String SYSTEM_PROMPT = """
            You are an n8n workflow expert. You generate one section of a larger workflow as JSON.
            Use real n8n node types such as n8n-nodes-base.httpRequest, n8n-nodes-base.if or n8n-nodes-base.set.
            Reply with a single JSON object and nothing else.""";

    private static final String BRANCH_TEMPLATE = """
            Create the "%s" branch of a workflow.

            Original request: %s
            Branch purpose: %s
            Runs when: %s
            Runs alongside other branches: %s
            Target node count: %d

            Rules:
            - Connect nodes linearly unless the branch needs a decision.
            - Route error handling nodes from output 1 of the node that can fail.
            - Prefix every node id with "%s_".
            - Reference nodes in connections by their exact name.
            - Do not add a trigger node; the branch is started by the main trigger.

            Return:
            {
              "nodes": [ { "id": "...", "name": "...", "type": "n8n-nodes-base...", "typeVersion": 1, "position": [x, y], "parameters": {} } ],
              "connections": { "Node Name": { "main": [[ { "node": "Next Node", "type": "main", "index": 0 } ]] } },
              "start_node": "first node name",
              "end_nodes": ["last node names"]
            }""";

    private final ChatModel chatModel;

    @Override
    public String generate(BranchPlan branch, String prompt) {
        String userPrompt = BRANCH_TEMPLATE.formatted(
                branch.name(), prompt, branch.description(),
                branch.triggerCondition() != null ? branch.triggerCondition() : "always",
                branch.parallel() ? "yes" : "no",
                branch.estimatedNodes() > 0 ? branch.estimatedNodes() : 5,
                FragmentPrefixes.of(branch.name()));
        List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPrompt));
        log.debug("Generating fragment branch={} estimatedNodes={}", branch.name(), branch.estimatedNodes());
        String reply = chatModel.chat(messages).aiMessage().text();
        log.debug("Generated fragment branch={} replyLength={}", branch.name(), reply != null ? reply.length() : 0);
        return reply;
    }
}
