package com.docforge.core.report;

import com.docforge.core.model.SourceOutcome;
import com.docforge.core.model.TestRun;
import com.docforge.core.model.TestSummary;
import com.docforge.core.model.UnitOutcome;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the reports of one build are rendered from.
 *
 * @param projectName project name
 * @param projectVersion project version
 * @param generatedAt report timestamp
 * @param validationPassed aggregate validation outcome
 * @param validationErrors every validation and source error, in source then file order
 * @param suggestions improvement suggestions from all verdicts of this build
 * @param testSummary counts over the tests executed in this build
 * @param filesTracked number of tracked source files
 * @param filesReprocessed number of files processed in this build
 */
public record BuildReport(
    String projectName,
    String projectVersion,
    LocalDateTime generatedAt,
    boolean validationPassed,
    List<String> validationErrors,
    List<String> suggestions,
    TestSummary testSummary,
    int filesTracked,
    int filesReprocessed
) {
    /**
     * Compact constructor with validation.
     */
    public BuildReport {
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(testSummary, "testSummary must not be null");
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Compiles a report from build outcomes.
     *
     * @param projectName project name
     * @param projectVersion project version
     * @param sources per-source outcomes
     * @param units per-file outcomes
     * @param validationPassed aggregate validation outcome
     * @return report
     */
    public static BuildReport of(String projectName, String projectVersion, List<SourceOutcome> sources,
                                 List<UnitOutcome> units, boolean validationPassed) {
        List<String> errors = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        List<TestRun> runs = new ArrayList<>();
        for (SourceOutcome source : sources) {
            if (!source.synced()) {
                errors.add(source.repo().displayName() + ": " + source.errorMessage());
            }
        }
        int reprocessed = 0;
        for (UnitOutcome unit : units) {
            if (!unit.validationPassed()) {
                List<String> unitErrors = unit.verdict().errors().isEmpty()
                    ? List.of(unit.verdict().firstError())
                    : unit.verdict().errors();
                for (String error : unitErrors) {
                    String prefix = unit.identifier() + ": ";
                    errors.add(error.startsWith(prefix) ? error : prefix + error);
                }
            }
            suggestions.addAll(unit.verdict().suggestions());
            runs.addAll(unit.testRuns());
            if (unit.reprocessed()) {
                reprocessed++;
            }
        }
        return new BuildReport(projectName, projectVersion, LocalDateTime.now(), validationPassed,
            errors, suggestions, TestSummary.of(runs), units.size(), reprocessed);
    }
}
