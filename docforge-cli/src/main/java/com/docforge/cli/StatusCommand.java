package com.docforge.cli;

import com.docforge.core.config.ConfigLoader;
import com.docforge.core.config.PipelineConfig;
import com.docforge.core.model.SourceOutcome;
import com.docforge.core.model.ValidationVerdict;
import com.docforge.core.pipeline.BuildOrchestrator;
import com.docforge.core.pipeline.BuildPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show which source files the next build would reprocess.
 *
 * <p>Syncs and discovers like a build, compares content against the cache, and prints
 * the changed and unchanged files. Nothing is generated, validated or written.
 */
@Command(
    name = "status",
    description = "List the files the next build would reprocess",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docforge.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        PipelineConfig config = ConfigLoader.load(configPath);
        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> System.err.println("✗ " + problem));
            return 1;
        }

        BuildOrchestrator orchestrator = null;
        Path base = configPath.toAbsolutePath().getParent();
        try (BuildEnvironment environment = BuildEnvironment.open(config, base == null ? Paths.get(".") : base)) {
            // planning never generates or validates
            orchestrator = environment.orchestrator(
                unit -> List.of(),
                request -> ValidationVerdict.failed("Validation is not available while planning"));
            BuildPlan plan = orchestrator.plan(environment.repositories());

            for (SourceOutcome source : plan.sources()) {
                System.out.println((source.synced() ? "✓ " : "✗ ") + source.repo().displayName()
                    + (source.synced() ? "" : ": " + source.errorMessage()));
            }
            if (plan.errorMessage() != null) {
                System.err.println("✗ " + plan.errorMessage());
                return 1;
            }

            System.out.println();
            plan.changed().forEach(id -> System.out.println("  changed    " + id));
            plan.unchanged().forEach(id -> System.out.println("  unchanged  " + id));
            System.out.println();
            System.out.println(plan.isUpToDate()
                ? "✓ Up to date (" + plan.unchanged().size() + " files)"
                : plan.changed().size() + " of " + (plan.changed().size() + plan.unchanged().size())
                    + " files would be reprocessed");
            return 0;
        } catch (Exception e) {
            log.error("Status failed", e);
            System.err.println("✗ Status failed: " + e.getMessage());
            return 1;
        } finally {
            if (orchestrator != null) {
                orchestrator.cleanup();
            }
        }
    }
}
