package com.docforge.core.validation;

import com.docforge.core.model.ValidationVerdict;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmDocValidatorTest {

    private static final ValidationRequest REQUEST =
        new ValidationRequest("def greet(name):\n    return name\n", "## greet\n\nGreets.");

    private static ChatModel replying(String text, AtomicReference<List<ChatMessage>> sent) {
        return new ChatModel() {
            @Override
            public ChatResponse chat(List<ChatMessage> messages) {
                sent.set(messages);
                return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
            }
        };
    }

    @Test
    void validate_validReply_returnsValidVerdict() {
        AtomicReference<List<ChatMessage>> sent = new AtomicReference<>();

        ValidationVerdict verdict = new LlmDocValidator(replying("VALID\nERRORS:\n- None\n", sent)).validate(REQUEST);

        assertThat(verdict.valid()).isTrue();
        String prompt = ((UserMessage) sent.get().get(1)).singleText();
        assertThat(prompt).contains("def greet(name):").contains("## greet");
    }

    @Test
    void validate_invalidReply_returnsErrors() {
        ValidationVerdict verdict = new LlmDocValidator(
            replying("INVALID\nERRORS:\n- Parameter mismatch\n", new AtomicReference<>())).validate(REQUEST);

        assertThat(verdict.valid()).isFalse();
        assertThat(verdict.errors()).containsExactly("Parameter mismatch");
    }

    @Test
    void validate_serviceFailure_propagatesInsteadOfInvalidVerdict() {
        ChatModel failing = new ChatModel() {
            @Override
            public ChatResponse chat(List<ChatMessage> messages) {
                throw new IllegalStateException("connection reset");
            }
        };

        LlmDocValidator validator = new LlmDocValidator(failing);

        assertThatThrownBy(() -> validator.validate(REQUEST))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("connection reset");
    }
}
