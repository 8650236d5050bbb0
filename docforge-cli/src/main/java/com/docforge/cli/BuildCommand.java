package com.docforge.cli;

import com.docforge.core.config.ConfigLoader;
import com.docforge.core.config.PipelineConfig;
import com.docforge.core.generation.ChatModels;
import com.docforge.core.generation.LlmExampleGenerator;
import com.docforge.core.model.BuildResult;
import com.docforge.core.model.SourceOutcome;
import com.docforge.core.model.TestSummary;
import com.docforge.core.model.TestRun;
import com.docforge.core.model.UnitOutcome;
import com.docforge.core.pipeline.BuildOrchestrator;
import com.docforge.core.validation.LlmDocValidator;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to run an incremental documentation build.
 *
 * <p>Syncs the configured sources, reprocesses the files that changed since the last
 * build, writes API pages and reports, and prints a summary.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>{@code 0} - validation and tests passed</li>
 *   <li>{@code 1} - the build could not run (configuration, credentials, report output)</li>
 *   <li>{@code 2} - validation failed</li>
 *   <li>{@code 3} - validation passed but a test failed</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docforge build
 * docforge build -c docs/docforge.yaml --keep-workspace
 * }</pre>
 */
@Command(
    name = "build",
    description = "Run an incremental documentation build",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    static final int EXIT_ERROR = 1;
    static final int EXIT_VALIDATION_FAILED = 2;
    static final int EXIT_TESTS_FAILED = 3;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docforge.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--api-key"},
        description = "Anthropic API key (default: $" + ChatModels.API_KEY_ENV + ")"
    )
    private String apiKey;

    @Option(
        names = {"--keep-workspace"},
        description = "Leave the synced sources in place after the build"
    )
    private boolean keepWorkspace;

    @Override
    public Integer call() {
        PipelineConfig config = ConfigLoader.load(configPath);
        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> System.err.println("✗ " + problem));
            return EXIT_ERROR;
        }

        String key = ChatModels.resolveApiKey(apiKey);
        if (key == null) {
            System.err.println("✗ No API key: pass --api-key or set " + ChatModels.API_KEY_ENV);
            return EXIT_ERROR;
        }

        ChatModel model;
        try {
            model = ChatModels.anthropic(config.generation(), key, config.execution().callTimeout());
        } catch (RuntimeException e) {
            System.err.println("✗ Cannot create model client: " + e.getMessage());
            return EXIT_ERROR;
        }

        BuildOrchestrator orchestrator = null;
        try (BuildEnvironment environment = BuildEnvironment.open(config, baseDirectory())) {
            orchestrator = environment.orchestrator(new LlmExampleGenerator(model), new LlmDocValidator(model));

            System.out.println("Building documentation for " + config.project().name());
            BuildResult result = orchestrator.build(environment.repositories());
            printSummary(result, environment);
            return exitCode(result);
        } catch (Exception e) {
            log.error("Build failed", e);
            System.err.println("✗ Build failed: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            if (orchestrator != null) {
                if (keepWorkspace) {
                    System.out.println("Workspace kept at " + orchestrator.workspaceRoot());
                } else {
                    orchestrator.cleanup();
                }
            }
        }
    }

    private Path baseDirectory() {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? Paths.get(".") : parent;
    }

    static int exitCode(BuildResult result) {
        if (!result.validationPassed()) {
            return EXIT_VALIDATION_FAILED;
        }
        return result.testsPassed() ? 0 : EXIT_TESTS_FAILED;
    }

    private static void printSummary(BuildResult result, BuildEnvironment environment) {
        System.out.println();
        for (SourceOutcome source : result.sources()) {
            if (source.synced()) {
                System.out.println("✓ Synced " + source.repo().displayName());
            } else {
                System.out.println("✗ Failed to sync " + source.repo().displayName() + ": " + source.errorMessage());
            }
        }

        System.out.println("Files tracked:     " + result.units().size());
        System.out.println("Files reprocessed: " + result.reprocessedCount());
        for (UnitOutcome unit : result.units()) {
            if (!unit.validationPassed()) {
                System.out.println("  ✗ " + unit.identifier() + ": " + unit.verdict().firstError());
            }
            unit.generationErrors().forEach(error -> System.out.println("  ! " + error));
        }

        List<TestRun> runs = result.units().stream().flatMap(unit -> unit.testRuns().stream()).toList();
        TestSummary tests = TestSummary.of(runs);
        System.out.println("Tests:             " + tests.passed() + "/" + tests.total() + " passed");

        System.out.println();
        System.out.println("API pages: " + environment.docsDirectory());
        System.out.println("Reports:   " + environment.reportsDirectory());
        if (result.succeeded()) {
            System.out.println("✓ Build succeeded");
        } else {
            System.out.println("✗ Build failed" + (result.errorMessage() == null ? "" : ": " + result.errorMessage()));
        }
    }
}
