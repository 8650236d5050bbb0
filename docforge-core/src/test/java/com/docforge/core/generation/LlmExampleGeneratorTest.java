package com.docforge.core.generation;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmExampleGeneratorTest {

    private static final DocumentableUnit GREET = new DocumentableUnit(
        "greet", "sdk.client", "Greet someone.", "greet(name, punctuation)",
        Path.of("sdk/client.py"), List.of("name", "punctuation"), "str");

    /**
     * Chat model returning a fixed reply and recording what it was sent.
     */
    private static final class FakeChatModel implements ChatModel {
        private final Supplier<String> reply;
        private final List<List<ChatMessage>> requests = new ArrayList<>();

        FakeChatModel(Supplier<String> reply) {
            this.reply = reply;
        }

        @Override
        public ChatResponse chat(List<ChatMessage> messages) {
            requests.add(messages);
            return ChatResponse.builder().aiMessage(AiMessage.from(reply.get())).build();
        }
    }

    @Test
    void generate_wellFormedReply_returnsParsedExamples() {
        FakeChatModel model = new FakeChatModel(() -> """
            EXAMPLE:
            Basic greeting
            CODE:
            print(greet("Ada", "!"))
            OUTPUT:
            Hello, Ada!
            TEST:
            assert greet("Ada", "!") == "Hello, Ada!"
            """);

        List<GeneratedArtifact> artifacts = new LlmExampleGenerator(model).generate(GREET);

        assertThat(artifacts).singleElement().satisfies(artifact -> {
            assertThat(artifact.description()).isEqualTo("Basic greeting");
            assertThat(artifact.hasTest()).isTrue();
        });
    }

    @Test
    void generate_sendsSystemAndUnitPrompt() {
        FakeChatModel model = new FakeChatModel(() -> "EXAMPLE:\nx\nCODE:\ny\n");

        new LlmExampleGenerator(model).generate(GREET);

        List<ChatMessage> messages = model.requests.get(0);
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        String prompt = ((UserMessage) messages.get(1)).singleText();
        assertThat(prompt)
            .contains("Method Name: greet")
            .contains("Module: sdk.client")
            .contains("Signature: greet(name, punctuation)")
            .contains("Docstring: Greet someone.")
            .contains("Return Type: str")
            .contains("pytest");
    }

    @Test
    void forUnit_javaUnit_asksForJUnitTests() {
        DocumentableUnit unit = DocumentableUnit.of("open", "com.acme.Client", null, "open()", Path.of("Client.java"));

        assertThat(ExamplePrompts.forUnit(unit))
            .contains("JUnit 5")
            .contains("Docstring: (none)")
            .contains("Return Type: None");
    }

    @Test
    void generate_serviceFailure_returnsEmpty() {
        FakeChatModel model = new FakeChatModel(() -> {
            throw new IllegalStateException("rate limited");
        });

        assertThat(new LlmExampleGenerator(model).generate(GREET)).isEmpty();
    }

    @Test
    void generate_emptyReply_returnsEmpty() {
        assertThat(new LlmExampleGenerator(new FakeChatModel(() -> "  ")).generate(GREET)).isEmpty();
    }

    @Test
    void constructor_nullModel_throws() {
        assertThatThrownBy(() -> new LlmExampleGenerator(null))
            .isInstanceOf(NullPointerException.class);
    }
}
