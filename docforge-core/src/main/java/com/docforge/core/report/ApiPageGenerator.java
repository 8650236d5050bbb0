package com.docforge.core.report;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import com.docforge.core.renderer.GeneratedFile;

import java.util.List;
import java.util.Map;

/**
 * Generates the Markdown API reference pages of tracked source files.
 *
 * <p>One page per source file lists every unit with its signature, docstring and
 * generated examples. The same page text is what validation checks against the source,
 * so a page always documents exactly one file.
 *
 * <pre>
 * docs/api/
 * ├── index.md              # Links to every page
 * └── sdk/
 *     └── client.md         # Page for sdk/client.py
 * </pre>
 */
public final class ApiPageGenerator {

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String FENCE = "```";
    private static final String INDEX = "index.md";

    private ApiPageGenerator() {
    }

    /**
     * Returns the page location for a tracked file identifier
     * ({@code sdk/client.py} becomes {@code sdk/client.md}).
     *
     * @param identifier tracked file identifier
     * @return relative page path
     */
    public static String pagePath(String identifier) {
        String relative = identifier.replace('\\', '/').replaceFirst("^/+", "").replace(":", "");
        int slash = relative.lastIndexOf('/');
        int dot = relative.lastIndexOf('.');
        String base = dot > slash ? relative.substring(0, dot) : relative;
        return base + ".md";
    }

    /**
     * Generates the page for one source file.
     *
     * @param identifier tracked file identifier, used as the title
     * @param units units declared in the file
     * @param artifacts generated artifacts per unit
     * @return Markdown page
     */
    public static String page(String identifier, List<DocumentableUnit> units,
                              Map<DocumentableUnit, List<GeneratedArtifact>> artifacts) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(identifier).append(DOUBLE_NEWLINE);
        for (DocumentableUnit unit : units) {
            sb.append(H2).append('`').append(unit.qualifiedName()).append('`').append(DOUBLE_NEWLINE);
            sb.append(FENCE).append(fenceLanguage(unit)).append(NEWLINE)
                .append(unit.signature());
            if (unit.returnType() != null) {
                sb.append(" -> ").append(unit.returnType());
            }
            sb.append(NEWLINE).append(FENCE).append(DOUBLE_NEWLINE);
            if (unit.hasDocstring()) {
                sb.append(unit.docstring()).append(DOUBLE_NEWLINE);
            }
            if (!unit.parameters().isEmpty()) {
                sb.append("**Parameters:** ");
                sb.append(String.join(", ", unit.parameters().stream().map(p -> "`" + p + "`").toList()));
                sb.append(DOUBLE_NEWLINE);
            }

            List<GeneratedArtifact> examples = artifacts.getOrDefault(unit, List.of());
            for (int i = 0; i < examples.size(); i++) {
                appendExample(sb, unit, i + 1, examples.get(i));
            }
        }
        return sb.toString();
    }

    private static void appendExample(StringBuilder sb, DocumentableUnit unit, int number, GeneratedArtifact example) {
        sb.append(H3).append("Example ").append(number);
        if (!example.description().isBlank()) {
            sb.append(": ").append(example.description().lines().findFirst().orElse(""));
        }
        sb.append(DOUBLE_NEWLINE);
        appendBlock(sb, fenceLanguage(unit), example.code());
        if (!example.expectedOutput().isBlank()) {
            sb.append("Output:").append(DOUBLE_NEWLINE);
            appendBlock(sb, "", example.expectedOutput());
        }
        if (example.hasTest()) {
            sb.append("Unit Test:").append(DOUBLE_NEWLINE);
            appendBlock(sb, fenceLanguage(unit), example.testCode());
        }
    }

    private static void appendBlock(StringBuilder sb, String language, String content) {
        sb.append(FENCE).append(language).append(NEWLINE)
            .append(content.stripTrailing()).append(NEWLINE)
            .append(FENCE).append(DOUBLE_NEWLINE);
    }

    private static String fenceLanguage(DocumentableUnit unit) {
        return switch (unit.language()) {
            case "py" -> "python";
            case "java" -> "java";
            default -> "";
        };
    }

    /**
     * Generates the index page linking every tracked file's page.
     *
     * @param projectName project name
     * @param identifiers tracked file identifiers
     * @return index file
     */
    public static GeneratedFile index(String projectName, List<String> identifiers) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(projectName).append(" API Reference").append(DOUBLE_NEWLINE);
        if (identifiers.isEmpty()) {
            sb.append("No documented source files.").append(NEWLINE);
        }
        for (String identifier : identifiers) {
            sb.append("- [").append(identifier).append("](").append(pagePath(identifier)).append(')').append(NEWLINE);
        }
        return GeneratedFile.markdown(INDEX, sb.toString());
    }
}
