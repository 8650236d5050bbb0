package com.docforge.core.generation;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Generates examples by prompting a chat model.
 *
 * <p>Service failures and empty responses are logged and yield no examples.
 */
public class LlmExampleGenerator implements ExampleGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmExampleGenerator.class);

    private final ChatModel chatModel;

    public LlmExampleGenerator(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel must not be null");
    }

    @Override
    public List<GeneratedArtifact> generate(DocumentableUnit unit) {
        List<ChatMessage> messages = List.of(
            SystemMessage.from(ExamplePrompts.SYSTEM),
            UserMessage.from(ExamplePrompts.forUnit(unit))
        );
        try {
            ChatResponse response = chatModel.chat(messages);
            String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
            if (text == null || text.isBlank()) {
                log.error("Empty response while generating examples for {}", unit.qualifiedName());
                return List.of();
            }
            List<GeneratedArtifact> artifacts = ExampleResponseParser.parse(text);
            log.debug("Generated {} examples for {}", artifacts.size(), unit.qualifiedName());
            return artifacts;
        } catch (RuntimeException e) {
            log.error("Failed to generate examples for {}: {}", unit.qualifiedName(), e.getMessage());
            return List.of();
        }
    }
}
