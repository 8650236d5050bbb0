package com.docforge.core.model;

import java.util.Objects;

/**
 * A test execution tied to the unit and example it exercised.
 *
 * @param unitName name of the documented unit
 * @param exampleDescription description of the example whose test ran
 * @param outcome execution outcome
 */
public record TestRun(
    String unitName,
    String exampleDescription,
    TestOutcome outcome
) {
    /**
     * Compact constructor with validation.
     */
    public TestRun {
        Objects.requireNonNull(unitName, "unitName must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (exampleDescription == null) {
            exampleDescription = "";
        }
    }

    /**
     * Formats the failure line used in test reports.
     *
     * @return {@code "<unit> - <example>: <error>"}
     */
    public String failureLine() {
        return unitName + " - " + exampleDescription + ": " + outcome.errorMessage();
    }
}
