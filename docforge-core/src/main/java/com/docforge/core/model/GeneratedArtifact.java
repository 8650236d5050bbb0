package com.docforge.core.model;

import java.util.Objects;

/**
 * Example content generated for a {@link DocumentableUnit}.
 *
 * @param description what the example demonstrates
 * @param code example code snippet
 * @param expectedOutput output the snippet is expected to produce
 * @param testCode generated unit test for the snippet, or null
 */
public record GeneratedArtifact(
    String description,
    String code,
    String expectedOutput,
    String testCode
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedArtifact {
        Objects.requireNonNull(code, "code must not be null");
        if (description == null) {
            description = "";
        }
        if (expectedOutput == null) {
            expectedOutput = "";
        }
        if (testCode != null && testCode.isBlank()) {
            testCode = null;
        }
    }

    /**
     * Returns true if this artifact carries test code to execute.
     *
     * @return true if test code is present
     */
    public boolean hasTest() {
        return testCode != null;
    }
}
