package com.docforge.core.report;

import com.docforge.core.model.TestSummary;
import com.docforge.core.renderer.GeneratedFile;
import com.docforge.core.renderer.GeneratedOutput;
import com.docforge.core.renderer.OutputRenderer;
import com.docforge.core.renderer.RenderContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Emits the Markdown test and validation reports plus machine-readable test metrics.
 *
 * <p>Files written to the reports directory:
 * <ul>
 *   <li>{@code test_report.md} - test execution summary and failures</li>
 *   <li>{@code validation_report.md} - overall status, errors and suggestions</li>
 *   <li>{@code test_metrics.json} - test counts and average coverage</li>
 * </ul>
 */
public class MarkdownReportEmitter implements ReportEmitter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportEmitter.class);

    static final String TEST_REPORT = "test_report.md";
    static final String VALIDATION_REPORT = "validation_report.md";
    static final String TEST_METRICS = "test_metrics.json";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String BULLET = "- ";

    private final Path reportsDirectory;
    private final OutputRenderer renderer;

    public MarkdownReportEmitter(Path reportsDirectory, OutputRenderer renderer) {
        this.reportsDirectory = Objects.requireNonNull(reportsDirectory, "reportsDirectory must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    @Override
    public void emit(BuildReport report) {
        try {
            GeneratedOutput output = GeneratedOutput.of(
                GeneratedFile.markdown(TEST_REPORT, testReport(report)),
                GeneratedFile.markdown(VALIDATION_REPORT, validationReport(report)),
                GeneratedFile.json(TEST_METRICS, testMetrics(report))
            );
            renderer.render(output, RenderContext.of(reportsDirectory));
            log.info("Generated reports in {}", reportsDirectory);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to generate reports: {}", e.getMessage());
            throw new ReportEmissionException("Failed to write reports to " + reportsDirectory, e);
        }
    }

    static String testReport(BuildReport report) {
        TestSummary summary = report.testSummary();
        StringBuilder sb = new StringBuilder();
        sb.append("# Test Execution Report").append(DOUBLE_NEWLINE);
        sb.append("Generated on: ").append(TIMESTAMP.format(report.generatedAt())).append(DOUBLE_NEWLINE);
        sb.append("## Summary").append(DOUBLE_NEWLINE);
        sb.append(BULLET).append("Total Tests: ").append(summary.total()).append(NEWLINE);
        sb.append(BULLET).append("Passed: ").append(summary.passed()).append(NEWLINE);
        sb.append(BULLET).append("Failed: ").append(summary.failed()).append(NEWLINE);
        sb.append(BULLET).append("Average Coverage: ").append(String.format(Locale.ROOT, "%.2f%%", summary.averageCoverage()))
            .append(NEWLINE);
        sb.append(BULLET).append("Files Reprocessed: ").append(report.filesReprocessed())
            .append(" of ").append(report.filesTracked()).append(NEWLINE);
        appendList(sb, "## Failures", summary.failures());
        return sb.toString();
    }

    static String validationReport(BuildReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Documentation Validation Report").append(DOUBLE_NEWLINE);
        sb.append("Generated on: ").append(TIMESTAMP.format(report.generatedAt())).append(DOUBLE_NEWLINE);
        sb.append("## Status").append(DOUBLE_NEWLINE);
        sb.append(BULLET).append("Overall Status: ").append(report.validationPassed() ? "✅ Valid" : "❌ Invalid")
            .append(NEWLINE);
        appendList(sb, "## Errors", report.validationErrors());
        appendList(sb, "## Suggestions", report.suggestions());
        return sb.toString();
    }

    static String testMetrics(BuildReport report) throws JsonProcessingException {
        TestSummary summary = report.testSummary();
        TestMetrics metrics = new TestMetrics(
            new TestMetrics.Summary(summary.total(), summary.passed(), summary.failed(), summary.averageCoverage()),
            summary.failures(),
            TIMESTAMP.format(report.generatedAt())
        );
        return JSON.writeValueAsString(metrics);
    }

    private static void appendList(StringBuilder sb, String header, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(NEWLINE).append(header).append(DOUBLE_NEWLINE);
        for (String item : items) {
            sb.append(BULLET).append(item).append(NEWLINE);
        }
    }

    /**
     * Shape of {@code test_metrics.json}.
     */
    record TestMetrics(
        @JsonProperty("summary") Summary summary,
        @JsonProperty("failures") List<String> failures,
        @JsonProperty("generated_at") String generatedAt
    ) {
        record Summary(
            @JsonProperty("total_methods") int totalMethods,
            @JsonProperty("passed") int passed,
            @JsonProperty("failed") int failed,
            @JsonProperty("average_coverage") double averageCoverage
        ) {}
    }
}
