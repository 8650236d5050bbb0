package com.docforge.cli;

import com.docforge.core.cache.ChangeTracker;
import com.docforge.core.config.PipelineConfig;
import com.docforge.core.discovery.CompositeUnitDiscovery;
import com.docforge.core.generation.ExampleGenerator;
import com.docforge.core.model.RepoConfig;
import com.docforge.core.pipeline.BuildOptions;
import com.docforge.core.pipeline.BuildOrchestrator;
import com.docforge.core.pipeline.BuildWorkspace;
import com.docforge.core.renderer.impl.FileSystemRenderer;
import com.docforge.core.report.MarkdownReportEmitter;
import com.docforge.core.sync.GitSourceSync;
import com.docforge.core.sync.RoutingSourceSync;
import com.docforge.core.testing.ProcessTestExecutor;
import com.docforge.core.validation.DocValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves configured locations and opens the cache and workspace shared by the commands.
 *
 * <p>Relative locations in the configuration are resolved against the directory holding
 * the configuration file. The cache directory and the docs and reports directories are
 * protected from workspace cleanup.
 */
final class BuildEnvironment implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(BuildEnvironment.class);

    private final PipelineConfig config;
    private final Path baseDirectory;
    private final Path docsDirectory;
    private final Path reportsDirectory;
    private final BuildWorkspace workspace;
    private final ChangeTracker tracker;

    private BuildEnvironment(PipelineConfig config, Path baseDirectory, Path docsDirectory, Path reportsDirectory,
                             BuildWorkspace workspace, ChangeTracker tracker) {
        this.config = config;
        this.baseDirectory = baseDirectory;
        this.docsDirectory = docsDirectory;
        this.reportsDirectory = reportsDirectory;
        this.workspace = workspace;
        this.tracker = tracker;
    }

    /**
     * Opens the environment described by a configuration.
     *
     * @param config loaded configuration
     * @param baseDirectory directory relative locations are resolved against
     * @return open environment
     * @throws IOException if the workspace cannot be created
     */
    static BuildEnvironment open(PipelineConfig config, Path baseDirectory) throws IOException {
        Path base = baseDirectory.toAbsolutePath().normalize();
        Path cacheFile = base.resolve(config.cache().file()).normalize();
        Path docs = base.resolve(config.output().docsDirectory()).normalize();
        Path reports = base.resolve(config.output().reportsDirectory()).normalize();

        BuildWorkspace workspace = config.workspace().directory() == null
            ? BuildWorkspace.temporary()
            : BuildWorkspace.at(base.resolve(config.workspace().directory()));
        Path cacheDirectory = cacheFile.getParent() == null ? cacheFile : cacheFile.getParent();
        workspace.protect(cacheDirectory, docs, reports);
        log.debug("Workspace: {}, cache: {}", workspace.root(), cacheFile);

        ChangeTracker tracker = ChangeTracker.open(cacheFile, workspace.root());
        return new BuildEnvironment(config, base, docs, reports, workspace, tracker);
    }

    /**
     * Assembles an orchestrator with the given generation and validation adapters.
     *
     * @param generator example generator
     * @param validator documentation validator
     * @return orchestrator bound to this environment
     */
    BuildOrchestrator orchestrator(ExampleGenerator generator, DocValidator validator) {
        FileSystemRenderer renderer = new FileSystemRenderer();
        return BuildOrchestrator.builder()
            .tracker(tracker)
            .workspace(workspace)
            .sourceSync(RoutingSourceSync.defaults())
            .discovery(CompositeUnitDiscovery.loadInstalled())
            .generator(generator)
            .validator(validator)
            .testExecutor(ProcessTestExecutor.from(config.testing()))
            .reportEmitter(new MarkdownReportEmitter(reportsDirectory, renderer))
            .pages(renderer, docsDirectory)
            .options(BuildOptions.from(config))
            .build();
    }

    /**
     * Returns the configured repositories with local locations made absolute.
     *
     * @return repositories ready to sync
     */
    List<RepoConfig> repositories() {
        return config.repositories().stream()
            .map(repo -> GitSourceSync.isGitLocation(repo.location())
                ? repo
                : new RepoConfig(repo.name(), baseDirectory.resolve(repo.location()).normalize().toString(), repo.paths()))
            .toList();
    }

    Path docsDirectory() {
        return docsDirectory;
    }

    Path reportsDirectory() {
        return reportsDirectory;
    }

    @Override
    public void close() {
        tracker.close();
    }
}
