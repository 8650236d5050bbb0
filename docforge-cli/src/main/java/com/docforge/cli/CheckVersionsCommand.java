package com.docforge.cli;

import com.docforge.core.config.ConfigLoader;
import com.docforge.core.versions.HttpMetadataFetcher;
import com.docforge.core.versions.MetadataFetcher;
import com.docforge.core.versions.TrackedPackage;
import com.docforge.core.versions.VersionCheck;
import com.docforge.core.versions.VersionMonitor;
import com.docforge.core.versions.VersionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to check the documented SDKs for new releases.
 *
 * <p>Looks up the latest release of each tracked package on PyPI or npm, compares it with
 * the versions recorded by the previous check, and records the new ones. With
 * {@code --build}, a detected release triggers a documentation build.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>{@code 0} - no new release</li>
 *   <li>{@code 1} - no package could be looked up, or the versions file could not be written</li>
 *   <li>{@code 4} - a new release was detected (without {@code --build})</li>
 *   <li>otherwise the exit code of the triggered build</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * docforge check-versions
 * docforge check-versions --pypi anthropic --npm @anthropic-ai/sdk --build
 * }</pre>
 */
@Command(
    name = "check-versions",
    description = "Check the documented SDKs for new releases",
    mixinStandardHelpOptions = true
)
public class CheckVersionsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckVersionsCommand.class);

    static final int EXIT_UPDATES = 4;

    @Option(
        names = {"--versions-file"},
        description = "Recorded SDK versions (default: config/sdk_versions.json)"
    )
    private Path versionsFile = VersionMonitor.DEFAULT_VERSIONS_FILE;

    @Option(names = {"--pypi"}, description = "PyPI package to track (repeatable)")
    private List<String> pypiPackages = new ArrayList<>();

    @Option(names = {"--npm"}, description = "npm package to track (repeatable)")
    private List<String> npmPackages = new ArrayList<>();

    @Option(
        names = {"--timeout"},
        description = "Registry request timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private long timeoutSeconds;

    @Option(names = {"--dry-run"}, description = "Report releases without recording them")
    private boolean dryRun;

    @Option(names = {"--build"}, description = "Run a documentation build when a release is detected")
    private boolean build;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file for the triggered build (default: docforge.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--api-key"}, description = "Anthropic API key for the triggered build")
    private String apiKey;

    private final MetadataFetcher fetcher;

    public CheckVersionsCommand() {
        this(null);
    }

    CheckVersionsCommand(MetadataFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public Integer call() {
        List<TrackedPackage> packages = trackedPackages();
        MetadataFetcher registryFetcher = fetcher != null
            ? fetcher
            : new HttpMetadataFetcher(Duration.ofSeconds(timeoutSeconds));
        VersionMonitor monitor = new VersionMonitor(versionsFile, registryFetcher, Clock.systemUTC());

        VersionCheck check = monitor.check(packages);
        for (Map.Entry<String, String> failure : check.failures().entrySet()) {
            System.err.println("✗ " + failure.getKey() + ": " + failure.getValue());
        }
        if (check.latest().isEmpty()) {
            System.err.println("✗ No package could be looked up");
            return BuildCommand.EXIT_ERROR;
        }

        if (!check.hasUpdates()) {
            System.out.println("✓ No new SDK releases (" + check.latest().size() + " packages checked)");
        } else {
            System.out.println("SDK releases detected:");
            for (VersionUpdate update : check.updates()) {
                System.out.println("  " + update);
            }
        }

        if (!dryRun) {
            try {
                monitor.save(check);
            } catch (IOException e) {
                log.error("Failed to record SDK versions", e);
                System.err.println("✗ Cannot write " + monitor.versionsFile() + ": " + e.getMessage());
                return BuildCommand.EXIT_ERROR;
            }
        }

        if (!check.hasUpdates()) {
            return 0;
        }
        if (!build) {
            return EXIT_UPDATES;
        }
        System.out.println();
        System.out.println("Triggering documentation build");
        return new CommandLine(new BuildCommand()).execute(buildArguments());
    }

    private List<TrackedPackage> trackedPackages() {
        if (pypiPackages.isEmpty() && npmPackages.isEmpty()) {
            return VersionMonitor.DEFAULT_PACKAGES;
        }
        List<TrackedPackage> packages = new ArrayList<>();
        pypiPackages.forEach(name -> packages.add(TrackedPackage.pypi(name)));
        npmPackages.forEach(name -> packages.add(TrackedPackage.npm(name)));
        return packages;
    }

    private String[] buildArguments() {
        List<String> arguments = new ArrayList<>(List.of("-c", configPath.toString()));
        if (apiKey != null) {
            arguments.add("--api-key");
            arguments.add(apiKey);
        }
        return arguments.toArray(String[]::new);
    }
}
