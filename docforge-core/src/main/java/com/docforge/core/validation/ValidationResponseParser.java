package com.docforge.core.validation;

import com.docforge.core.model.ValidationVerdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the structured verdict returned by the generative service.
 *
 * <p>Expected shape:
 * <pre>
 * VALID|INVALID
 * ERRORS:
 * - Error 1
 * SUGGESTIONS:
 * - Suggestion 1
 * </pre>
 *
 * <p>The verdict token is the first non-blank line. A response without a recognizable
 * token is an invalid verdict.
 */
public final class ValidationResponseParser {

    static final String UNRECOGNIZED = "Unrecognized validation response";

    private ValidationResponseParser() {
    }

    /**
     * Parses a response into a verdict.
     *
     * @param content response text
     * @return parsed verdict
     */
    public static ValidationVerdict parse(String content) {
        if (content == null || content.isBlank()) {
            return ValidationVerdict.failed("Empty validation response");
        }

        Boolean valid = null;
        List<String> errors = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        List<String> target = null;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            String upper = line.toUpperCase(Locale.ROOT).replace("*", "");
            if (valid == null) {
                if (upper.startsWith("INVALID")) {
                    valid = false;
                    continue;
                }
                if (upper.startsWith("VALID")) {
                    valid = true;
                    continue;
                }
            }
            if (upper.startsWith("ERRORS:")) {
                target = errors;
                addInline(line, target);
            } else if (upper.startsWith("SUGGESTIONS:")) {
                target = suggestions;
                addInline(line, target);
            } else if (target != null && (line.startsWith("-") || line.startsWith("*"))) {
                addItem(line.substring(1), target);
            }
        }

        if (valid == null) {
            errors.add(0, UNRECOGNIZED);
            return new ValidationVerdict(false, errors, suggestions);
        }
        return new ValidationVerdict(valid, errors, suggestions);
    }

    private static void addInline(String line, List<String> target) {
        addItem(line.substring(line.indexOf(':') + 1), target);
    }

    private static void addItem(String text, List<String> target) {
        String item = text.strip();
        if (!item.isEmpty() && !item.equalsIgnoreCase("none")) {
            target.add(item);
        }
    }
}
