package com.docforge.core.testing;

import com.docforge.core.config.PipelineConfig;
import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import com.docforge.core.model.TestOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessTestExecutorTest {

    private static final String JAVA = ProcessHandle.current().info().command().orElse("java");

    private static final DocumentableUnit PYTHON_UNIT =
        DocumentableUnit.of("greet", "sdk.client", null, "greet(name)", Path.of("sdk/client.py"));

    @TempDir
    Path tempDir;

    @Test
    void parseCoverage_totalLine_returnsPercentage() {
        String output = """
            Name            Stmts   Miss  Cover
            -----------------------------------
            sdk/client.py      10      2    80%
            TOTAL              12      3    75.5%
            1 passed in 0.02s
            """;

        assertThat(ProcessTestExecutor.parseCoverage(output)).isEqualTo(75.5);
    }

    @Test
    void parseCoverage_noTotalLine_returnsZero() {
        assertThat(ProcessTestExecutor.parseCoverage("1 passed in 0.02s")).isZero();
        assertThat(ProcessTestExecutor.parseCoverage(null)).isZero();
    }

    @Test
    void supports_configuredExtensionsOnly() {
        ProcessTestExecutor executor = ProcessTestExecutor.from(PipelineConfig.defaults().testing());

        assertThat(executor.supports(PYTHON_UNIT)).isTrue();
        assertThat(executor.supports(DocumentableUnit.of("open", "Client", null, "open()", Path.of("Client.java"))))
            .isFalse();
    }

    @Test
    void execute_artifactWithoutTest_fails() {
        ProcessTestExecutor executor = new ProcessTestExecutor(List.of(JAVA), Duration.ofSeconds(30), Set.of("py"));

        TestOutcome outcome = executor.execute(new GeneratedArtifact("d", "x = 1", "", null), PYTHON_UNIT, tempDir);

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.errorMessage()).isEqualTo("No test code");
    }

    @Test
    void execute_failingRunner_failsAndRemovesTestFile() throws Exception {
        ProcessTestExecutor executor = new ProcessTestExecutor(
            List.of(JAVA, "-no-such-option"), Duration.ofSeconds(30), Set.of("py"));

        TestOutcome outcome = executor.execute(
            new GeneratedArtifact("d", "x = 1", "", "def test_x():\n    assert True\n"), PYTHON_UNIT, tempDir);

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.errorMessage()).startsWith("Tests failed with exit code ");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void constructor_emptyCommand_throws() {
        assertThatThrownBy(() -> new ProcessTestExecutor(List.of(), Duration.ofSeconds(1), Set.of("py")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
