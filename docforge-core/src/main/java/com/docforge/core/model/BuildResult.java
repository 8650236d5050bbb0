package com.docforge.core.model;

import java.util.List;

/**
 * Outcome of one orchestration run.
 *
 * <p>Constructed once per build and returned to the caller. Never persisted; only the
 * change tracker's state survives a build.
 *
 * @param validationPassed true iff no tracked file (changed or cached) failed validation
 *                         and every configured source was acquired
 * @param testsPassed true iff no executed test failed
 * @param errorMessage first recorded validation or fatal-stage error, or null
 * @param sources per-source acquisition outcomes
 * @param units per-file outcomes in discovery order
 */
public record BuildResult(
    boolean validationPassed,
    boolean testsPassed,
    String errorMessage,
    List<SourceOutcome> sources,
    List<UnitOutcome> units
) {
    /**
     * Compact constructor with validation.
     */
    public BuildResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        units = units == null ? List.of() : List.copyOf(units);
    }

    /**
     * Creates the result of a build aborted by a structural failure.
     *
     * @param errorMessage failure description
     * @param sources sources acquired before the failure
     * @return failed result
     */
    public static BuildResult aborted(String errorMessage, List<SourceOutcome> sources) {
        return new BuildResult(false, false, errorMessage, sources, List.of());
    }

    /**
     * Returns true if both validation and tests passed.
     *
     * @return overall success
     */
    public boolean succeeded() {
        return validationPassed && testsPassed;
    }

    /**
     * Returns the number of files reprocessed in this build.
     *
     * @return count of reprocessed files
     */
    public long reprocessedCount() {
        return units.stream().filter(UnitOutcome::reprocessed).count();
    }
}
