package com.example.workflowsynth.config;

import com.example.workflowsynth.llm.OpenRouterChatModelFactory;
import com.example.workflowsynth.synthesis.ChatModelFragmentGenerator;
import com.example.workflowsynth.synthesis.FragmentGenerator;
import com.example.workflowsynth.synthesis.WorkflowPlanner;

import dev.langchain4j.model.chat.ChatModel;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import tools.jackson.databind.json.JsonMapper;

@Configuration
public class LlmConfiguration {

    @Bean
    public ChatModel chatModel(OpenRouterChatModelFactory chatModelFactory,
                               @Value("${openrouter.temperature:#{null}}") Double temperature,
                               @Value("${openrouter.max-tokens:#{null}}") Integer maxTokens) {
        return chatModelFactory.build(null, null, temperature, maxTokens);
    }

    @Bean
    public WorkflowPlanner workflowPlanner(ChatModel chatModel, JsonMapper jsonMapper) {
        return new WorkflowPlanner(chatModel, jsonMapper);
    }

    @Bean
    public FragmentGenerator fragmentGenerator(ChatModel chatModel) {
        return new ChatModelFragmentGenerator(chatModel);
    }
}
