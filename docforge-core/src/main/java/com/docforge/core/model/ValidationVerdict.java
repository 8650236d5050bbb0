package com.docforge.core.model;

import java.util.List;

/**
 * Verdict returned by documentation validation.
 *
 * <p>An invalid verdict is a normal outcome, not an error: it flips the build's
 * validation flag but never aborts the build.
 *
 * @param valid whether the documentation matches the source
 * @param errors specific problems found
 * @param suggestions improvement suggestions
 */
public record ValidationVerdict(
    boolean valid,
    List<String> errors,
    List<String> suggestions
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationVerdict {
        errors = errors == null ? List.of() : List.copyOf(errors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Creates a passing verdict with no findings.
     *
     * @return valid verdict
     */
    public static ValidationVerdict passed() {
        return new ValidationVerdict(true, List.of(), List.of());
    }

    /**
     * Creates a failing verdict with a single error.
     *
     * @param error error message
     * @return invalid verdict
     */
    public static ValidationVerdict failed(String error) {
        return new ValidationVerdict(false, List.of(error), List.of());
    }

    /**
     * Returns the first error, or a generic message when an invalid verdict carries none.
     *
     * @return first error text, or null for a valid verdict without errors
     */
    public String firstError() {
        if (!errors.isEmpty()) {
            return errors.get(0);
        }
        return valid ? null : "Documentation is invalid";
    }
}
