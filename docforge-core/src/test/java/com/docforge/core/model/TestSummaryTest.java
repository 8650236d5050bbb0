package com.docforge.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TestSummaryTest {

    @Test
    void of_noRuns_isEmptyAndPassing() {
        TestSummary summary = TestSummary.of(List.of());

        assertThat(summary.total()).isZero();
        assertThat(summary.averageCoverage()).isZero();
        assertThat(summary.allPassed()).isTrue();
    }

    @Test
    void of_mixedRuns_countsFailuresWithLines() {
        TestSummary summary = TestSummary.of(List.of(
            new TestRun("greet", "Basic", TestOutcome.success(90.0)),
            new TestRun("greet", null, TestOutcome.failure("No tests collected"))));

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.allPassed()).isFalse();
        assertThat(summary.averageCoverage()).isEqualTo(45.0);
        assertThat(summary.failures()).containsExactly("greet - : No tests collected");
    }

    @Test
    void testOutcome_negativeCoverage_isClampedToZero() {
        assertThat(new TestOutcome(true, -3.0, null).coveragePercentage()).isZero();
    }
}
