package com.docforge.cli;

import com.docforge.core.cache.ChangeTracker;
import com.docforge.core.config.ConfigLoader;
import com.docforge.core.config.PipelineConfig;
import com.docforge.core.pipeline.BuildWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to remove the configured workspace and, optionally, the build cache.
 */
@Command(
    name = "clean",
    description = "Remove the workspace (and with --cache, the build cache)",
    mixinStandardHelpOptions = true
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docforge.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--cache"},
        description = "Also clear the build cache, forcing a full rebuild"
    )
    private boolean clearCache;

    @Override
    public Integer call() {
        PipelineConfig config = ConfigLoader.load(configPath);
        Path parent = configPath.toAbsolutePath().getParent();
        Path base = parent == null ? Paths.get(".").toAbsolutePath() : parent;
        Path cacheFile = base.resolve(config.cache().file()).normalize();

        try {
            if (config.workspace().directory() != null) {
                Path directory = base.resolve(config.workspace().directory()).normalize();
                if (Files.isDirectory(directory)) {
                    BuildWorkspace workspace = BuildWorkspace.at(directory);
                    workspace.protect(cacheFile.getParent(), base.resolve(config.output().docsDirectory()),
                        base.resolve(config.output().reportsDirectory()));
                    workspace.cleanup();
                    System.out.println("✓ Removed workspace " + directory);
                }
            } else {
                log.debug("No fixed workspace configured; builds use temporary directories");
            }

            if (clearCache) {
                try (ChangeTracker tracker = ChangeTracker.open(cacheFile, base)) {
                    int entries = tracker.size();
                    tracker.clear();
                    System.out.println("✓ Cleared " + entries + " cache entries from " + cacheFile);
                }
            }
            return 0;
        } catch (Exception e) {
            log.error("Clean failed", e);
            System.err.println("✗ Clean failed: " + e.getMessage());
            return 1;
        }
    }
}
