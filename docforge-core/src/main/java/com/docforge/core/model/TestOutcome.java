package com.docforge.core.model;

/**
 * Result of executing one piece of generated test code.
 *
 * @param passed whether the test run succeeded
 * @param coveragePercentage line coverage reported by the runner, 0 when unknown
 * @param errorMessage failure description, or null when passed
 */
public record TestOutcome(
    boolean passed,
    double coveragePercentage,
    String errorMessage
) {
    /**
     * Compact constructor with validation.
     */
    public TestOutcome {
        if (coveragePercentage < 0 || Double.isNaN(coveragePercentage)) {
            coveragePercentage = 0.0;
        }
    }

    public static TestOutcome success(double coveragePercentage) {
        return new TestOutcome(true, coveragePercentage, null);
    }

    public static TestOutcome failure(String errorMessage) {
        return new TestOutcome(false, 0.0, errorMessage);
    }
}
