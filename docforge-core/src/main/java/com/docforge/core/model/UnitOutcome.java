package com.docforge.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome for one tracked source file within a build.
 *
 * <p>A tracked file holds one or more {@link DocumentableUnit}s. When the file was
 * unchanged since the last build, {@code reprocessed} is false, artifacts and test runs
 * are empty, and the verdict mirrors the cached validation result.
 *
 * @param identifier stable cache identifier of the file
 * @param sourceFile file path in the current workspace
 * @param units documentable units found in the file
 * @param artifacts generated artifacts for all units of the file
 * @param verdict validation verdict for the file
 * @param testRuns executed test runs
 * @param generationErrors per-unit generation failures
 * @param reprocessed true if generation and validation ran in this build
 */
public record UnitOutcome(
    String identifier,
    Path sourceFile,
    List<DocumentableUnit> units,
    List<GeneratedArtifact> artifacts,
    ValidationVerdict verdict,
    List<TestRun> testRuns,
    List<String> generationErrors,
    boolean reprocessed
) {
    /**
     * Compact constructor with validation.
     */
    public UnitOutcome {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        units = units == null ? List.of() : List.copyOf(units);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        testRuns = testRuns == null ? List.of() : List.copyOf(testRuns);
        generationErrors = generationErrors == null ? List.of() : List.copyOf(generationErrors);
    }

    /**
     * Creates the outcome of a file whose cached result was reused.
     *
     * @param identifier cache identifier
     * @param sourceFile file path
     * @param units units found in the file
     * @param cachedResult last validation result from the cache
     * @return outcome marked as not reprocessed
     */
    public static UnitOutcome cached(String identifier, Path sourceFile, List<DocumentableUnit> units, boolean cachedResult) {
        ValidationVerdict verdict = cachedResult
            ? ValidationVerdict.passed()
            : ValidationVerdict.failed(identifier + ": validation failed in a previous build and the source is unchanged");
        return new UnitOutcome(identifier, sourceFile, units, List.of(), verdict, List.of(), List.of(), false);
    }

    public boolean validationPassed() {
        return verdict.valid();
    }

    public boolean testsPassed() {
        return testRuns.stream().allMatch(run -> run.outcome().passed());
    }
}
