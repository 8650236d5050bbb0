package com.docforge.core.report;

import com.docforge.core.model.GeneratedArtifact;
import com.docforge.core.model.RepoConfig;
import com.docforge.core.model.SourceOutcome;
import com.docforge.core.model.TestOutcome;
import com.docforge.core.model.TestRun;
import com.docforge.core.model.UnitOutcome;
import com.docforge.core.model.ValidationVerdict;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BuildReportTest {

    private static UnitOutcome processed(String identifier, ValidationVerdict verdict, List<TestRun> runs) {
        return new UnitOutcome(identifier, Path.of(identifier), List.of(),
            List.of(new GeneratedArtifact("d", "x", "", null)), verdict, runs, List.of(), true);
    }

    @Test
    void of_collectsErrorsInSourceThenFileOrder() {
        SourceOutcome failedSource = SourceOutcome.failed(
            new RepoConfig("sdk", "https://example.com/sdk.git", List.of()), Path.of("sdk"), "clone failed");
        List<UnitOutcome> units = List.of(
            processed("sdk/a.py", new ValidationVerdict(false, List.of("Parameter mismatch", "Missing return"),
                List.of("Add an example")), List.of()),
            UnitOutcome.cached("sdk/b.py", Path.of("sdk/b.py"), List.of(), false),
            UnitOutcome.cached("sdk/c.py", Path.of("sdk/c.py"), List.of(), true));

        BuildReport report = BuildReport.of("demo", "1.0", List.of(failedSource), units, false);

        assertThat(report.validationErrors()).containsExactly(
            "sdk: clone failed",
            "sdk/a.py: Parameter mismatch",
            "sdk/a.py: Missing return",
            "sdk/b.py: validation failed in a previous build and the source is unchanged");
        assertThat(report.suggestions()).containsExactly("Add an example");
        assertThat(report.filesTracked()).isEqualTo(3);
        assertThat(report.filesReprocessed()).isEqualTo(1);
        assertThat(report.validationPassed()).isFalse();
    }

    @Test
    void of_invalidVerdictWithoutErrors_reportsGenericError() {
        UnitOutcome unit = processed("a.py", new ValidationVerdict(false, List.of(), List.of()), List.of());

        BuildReport report = BuildReport.of("demo", "1.0", List.of(), List.of(unit), false);

        assertThat(report.validationErrors()).containsExactly("a.py: Documentation is invalid");
    }

    @Test
    void of_testRuns_summarizedAcrossFiles() {
        List<UnitOutcome> units = List.of(
            processed("a.py", ValidationVerdict.passed(), List.of(
                new TestRun("greet", "Basic", TestOutcome.success(80.0)),
                new TestRun("greet", "Edge", TestOutcome.failure("Tests failed with exit code 1")))),
            processed("b.py", ValidationVerdict.passed(), List.of(
                new TestRun("load", "Load", TestOutcome.success(100.0)))));

        BuildReport report = BuildReport.of("demo", "1.0", List.of(), units, true);

        assertThat(report.testSummary().total()).isEqualTo(3);
        assertThat(report.testSummary().passed()).isEqualTo(2);
        assertThat(report.testSummary().averageCoverage()).isEqualTo(60.0);
        assertThat(report.testSummary().failures())
            .containsExactly("greet - Edge: Tests failed with exit code 1");
        assertThat(report.validationErrors()).isEmpty();
    }
}
