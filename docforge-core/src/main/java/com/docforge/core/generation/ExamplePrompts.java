package com.docforge.core.generation;

import com.docforge.core.model.DocumentableUnit;

/**
 * Prompt texts for example generation.
 */
final class ExamplePrompts {

    static final String SYSTEM = "You are a technical documentation assistant. Generate clear, practical code examples "
        + "that demonstrate proper API usage. Include test cases that verify the functionality.";

    private ExamplePrompts() {
    }

    static String forUnit(DocumentableUnit unit) {
        String language = "java".equals(unit.language()) ? "Java" : "Python";
        String framework = "java".equals(unit.language()) ? "JUnit 5" : "pytest";
        return """
            Please generate example code and tests for this API method:

            Method Name: %s
            Module: %s
            Signature: %s
            Docstring: %s
            Parameters: %s
            Return Type: %s

            For each example, provide:
            1. A description of what the example demonstrates
            2. The example code itself (%s)
            3. The output the example code produces
            4. A %s test case that verifies the example works

            Format each example as:
            EXAMPLE:
            <description>
            CODE:
            <example code>
            OUTPUT:
            <expected output>
            TEST:
            <test code>

            Generate 2-3 examples that show different use cases.
            """.formatted(
                unit.name(),
                unit.module(),
                unit.signature(),
                unit.hasDocstring() ? unit.docstring() : "(none)",
                unit.parameters(),
                unit.returnType() == null ? "None" : unit.returnType(),
                language,
                framework
            );
    }
}
