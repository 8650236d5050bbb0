package com.docforge.core.generation;

import com.docforge.core.config.PipelineConfig;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import java.time.Duration;
import java.util.Objects;

/**
 * Factory for the chat models backing generation and validation.
 */
public final class ChatModels {

    /**
     * Environment variable consulted when no API key is given explicitly.
     */
    public static final String API_KEY_ENV = "ANTHROPIC_API_KEY";

    private ChatModels() {
    }

    /**
     * Creates an Anthropic chat model.
     *
     * @param settings model name, token limit and temperature
     * @param apiKey API key
     * @param timeout request timeout
     * @return chat model
     */
    public static ChatModel anthropic(PipelineConfig.GenerationConfig settings, String apiKey, Duration timeout) {
        Objects.requireNonNull(apiKey, "apiKey must not be null");
        return AnthropicChatModel.builder()
            .apiKey(apiKey)
            .modelName(settings.model())
            .maxTokens(settings.maxTokens())
            .temperature(settings.temperature())
            .timeout(timeout)
            .build();
    }

    /**
     * Returns the explicit key if present, otherwise the {@value #API_KEY_ENV} variable.
     *
     * @param explicitKey key given on the command line, or null
     * @return API key, or null if none is configured
     */
    public static String resolveApiKey(String explicitKey) {
        if (explicitKey != null && !explicitKey.isBlank()) {
            return explicitKey;
        }
        String fromEnv = System.getenv(API_KEY_ENV);
        return fromEnv == null || fromEnv.isBlank() ? null : fromEnv;
    }
}
