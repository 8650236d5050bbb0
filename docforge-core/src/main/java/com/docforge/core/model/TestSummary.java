package com.docforge.core.model;

import java.util.List;

/**
 * Aggregated counts over all test runs of a build.
 *
 * @param total number of tests executed
 * @param passed number of passing tests
 * @param failures failure lines, one per failing test
 * @param averageCoverage mean coverage over all runs, 0 when none ran
 */
public record TestSummary(
    int total,
    int passed,
    List<String> failures,
    double averageCoverage
) {
    /**
     * Compact constructor with validation.
     */
    public TestSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Compiles a summary from individual test runs.
     *
     * @param runs executed test runs
     * @return summary counts
     */
    public static TestSummary of(List<TestRun> runs) {
        int passed = 0;
        double coverage = 0.0;
        List<String> failures = new java.util.ArrayList<>();
        for (TestRun run : runs) {
            coverage += run.outcome().coveragePercentage();
            if (run.outcome().passed()) {
                passed++;
            } else {
                failures.add(run.failureLine());
            }
        }
        double average = runs.isEmpty() ? 0.0 : coverage / runs.size();
        return new TestSummary(runs.size(), passed, failures, average);
    }

    public int failed() {
        return total - passed;
    }

    public boolean allPassed() {
        return passed == total;
    }
}
