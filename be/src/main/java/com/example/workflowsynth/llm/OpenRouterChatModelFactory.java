package com.example.workflowsynth.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the {@link ChatModel} that plans workflows and generates fragments, against OpenRouter's
 * OpenAI-compatible API. The API key comes from config/env only; startup fails if it is missing.
 */
@Component
public class OpenRouterChatModelFactory {

    static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    private final String apiKey;
    private final String defaultBaseUrl;
    private final String defaultModel;

    public OpenRouterChatModelFactory(
            @Value("${openrouter.api-key:}") String apiKey,
            @Value("${openrouter.base-url:" + DEFAULT_BASE_URL + "}") String defaultBaseUrl,
            @Value("${openrouter.model:" + DEFAULT_MODEL + "}") String defaultModel) {
        String key = apiKey != null ? apiKey.trim() : "";
        if (key.isEmpty()) {
            throw new IllegalStateException(
                    "OpenRouter API key is required. Set OPENROUTER_API_KEY in the environment or openrouter.api-key in configuration.");
        }
        this.apiKey = key;
        this.defaultBaseUrl = defaultBaseUrl != null && !defaultBaseUrl.isBlank() ? defaultBaseUrl.trim() : DEFAULT_BASE_URL;
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel.trim() : DEFAULT_MODEL;
    }

    /**
     * Builds a ChatModel for the given base URL and model name; null or blank falls back to the configured default.
     * A null temperature or token limit leaves the provider's default.
     */
    public ChatModel build(String baseUrl, String modelName, Double temperature, Integer maxTokens) {
        String url = (baseUrl != null && !baseUrl.isBlank()) ? baseUrl.trim() : defaultBaseUrl;
        String model = (modelName != null && !modelName.isBlank()) ? modelName.trim() : defaultModel;
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(url)
                .modelName(model)
                .timeout(Duration.ofSeconds(120));
        if (temperature != null) {
            builder.temperature(temperature);
        }
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }
}
