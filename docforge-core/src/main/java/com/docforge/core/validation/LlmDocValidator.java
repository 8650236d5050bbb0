package com.docforge.core.validation;

import com.docforge.core.model.ValidationVerdict;
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
 * Validates documentation by asking a chat model to compare it with the source.
 */
public class LlmDocValidator implements DocValidator {

    private static final Logger log = LoggerFactory.getLogger(LlmDocValidator.class);

    static final String SYSTEM = "You are a technical documentation validator. Your task is to verify the accuracy "
        + "of API documentation against source code. Be thorough and precise in your analysis.";

    private final ChatModel chatModel;

    public LlmDocValidator(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel must not be null");
    }

    @Override
    public ValidationVerdict validate(ValidationRequest request) {
        List<ChatMessage> messages = List.of(
            SystemMessage.from(SYSTEM),
            UserMessage.from(prompt(request))
        );
        try {
            ChatResponse response = chatModel.chat(messages);
            String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
            ValidationVerdict verdict = ValidationResponseParser.parse(text);
            if (!verdict.valid()) {
                log.warn("Validation failed with errors:");
                verdict.errors().forEach(error -> log.warn("- {}", error));
            }
            return verdict;
        } catch (RuntimeException e) {
            log.error("Validation request failed: {}", e.getMessage());
            throw e;
        }
    }

    static String prompt(ValidationRequest request) {
        return """
            Please validate the following API documentation against the source code:

            Source Code:
            ```
            %s
            ```

            Documentation:
            ```markdown
            %s
            ```

            Please:
            1. Verify that all documented functions and parameters match the source code
            2. Check that return types and descriptions are accurate
            3. Validate that example code is correct
            4. Identify any missing or outdated documentation

            Respond with:
            - VALID if documentation is accurate
            - INVALID if there are errors, followed by a list of specific issues
            - Include specific suggestions for improvements

            Your response should be structured as:
            VALID|INVALID
            ERRORS:
            - Error 1
            - Error 2
            SUGGESTIONS:
            - Suggestion 1
            """.formatted(request.source(), request.documentation());
    }
}
