package com.docforge.core.generation;

import com.docforge.core.model.GeneratedArtifact;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the sectioned example format returned by the generative service.
 *
 * <p>Each example starts with an {@code EXAMPLE:} line followed by its description, then
 * {@code CODE:}, optionally {@code OUTPUT:}, and optionally {@code TEST:} sections.
 * Markdown code fences inside sections are stripped. Examples without code are dropped.
 */
public final class ExampleResponseParser {

    private enum Section { DESCRIPTION, CODE, OUTPUT, TEST }

    private ExampleResponseParser() {
    }

    /**
     * Parses all examples from a response.
     *
     * @param content response text
     * @return parsed artifacts in response order
     */
    public static List<GeneratedArtifact> parse(String content) {
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return artifacts;
        }

        Builder current = null;
        Section section = null;
        for (String line : content.split("\\R")) {
            String marker = line.strip().toUpperCase(Locale.ROOT);
            if (marker.startsWith("EXAMPLE:")) {
                addIfComplete(current, artifacts);
                current = new Builder();
                section = Section.DESCRIPTION;
                appendInline(current, section, line);
            } else if (current != null && marker.startsWith("CODE:")) {
                section = Section.CODE;
                appendInline(current, section, line);
            } else if (current != null && marker.startsWith("OUTPUT:")) {
                section = Section.OUTPUT;
                appendInline(current, section, line);
            } else if (current != null && marker.startsWith("TEST:")) {
                section = Section.TEST;
                appendInline(current, section, line);
            } else if (current != null && !isFence(line)) {
                current.append(section, line);
            }
        }
        addIfComplete(current, artifacts);
        return artifacts;
    }

    private static void appendInline(Builder builder, Section section, String line) {
        String rest = line.substring(line.indexOf(':') + 1);
        if (!rest.isBlank() && !isFence(rest)) {
            builder.append(section, rest.strip());
        }
    }

    private static boolean isFence(String line) {
        return line.strip().startsWith("```");
    }

    private static void addIfComplete(Builder builder, List<GeneratedArtifact> artifacts) {
        if (builder != null && !builder.code.toString().isBlank()) {
            artifacts.add(builder.build());
        }
    }

    private static final class Builder {
        private final StringBuilder description = new StringBuilder();
        private final StringBuilder code = new StringBuilder();
        private final StringBuilder output = new StringBuilder();
        private final StringBuilder test = new StringBuilder();

        void append(Section section, String line) {
            StringBuilder target = switch (section) {
                case DESCRIPTION -> description;
                case CODE -> code;
                case OUTPUT -> output;
                case TEST -> test;
            };
            if (section == Section.DESCRIPTION && line.isBlank()) {
                return;
            }
            target.append(line).append('\n');
        }

        GeneratedArtifact build() {
            return new GeneratedArtifact(
                description.toString().strip(),
                code.toString().strip(),
                output.toString().strip(),
                test.toString().strip()
            );
        }
    }
}
