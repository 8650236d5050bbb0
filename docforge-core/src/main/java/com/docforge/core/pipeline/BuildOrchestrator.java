package com.docforge.core.pipeline;

import com.docforge.core.cache.ChangeTracker;
import com.docforge.core.cache.TrackedUnitState;
import com.docforge.core.discovery.DiscoveryException;
import com.docforge.core.discovery.UnitDiscovery;
import com.docforge.core.generation.ExampleGenerator;
import com.docforge.core.model.BuildResult;
import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import com.docforge.core.model.RepoConfig;
import com.docforge.core.model.SourceOutcome;
import com.docforge.core.model.TestOutcome;
import com.docforge.core.model.TestRun;
import com.docforge.core.model.UnitOutcome;
import com.docforge.core.model.ValidationVerdict;
import com.docforge.core.renderer.GeneratedFile;
import com.docforge.core.renderer.GeneratedOutput;
import com.docforge.core.renderer.OutputRenderer;
import com.docforge.core.renderer.RenderContext;
import com.docforge.core.report.ApiPageGenerator;
import com.docforge.core.report.BuildReport;
import com.docforge.core.report.ReportEmissionException;
import com.docforge.core.report.ReportEmitter;
import com.docforge.core.sync.SourceSync;
import com.docforge.core.sync.SyncException;
import com.docforge.core.testing.TestExecutor;
import com.docforge.core.validation.DocValidator;
import com.docforge.core.validation.ValidationRequest;
import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sequences the documentation pipeline for one build and aggregates its outcome.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li><b>Acquire:</b> sync every source into its own workspace directory. A failed
 *       source is recorded and skipped; the others proceed.</li>
 *   <li><b>Discover:</b> find documentable units in the synced sources. Failure aborts
 *       the build with a failed result.</li>
 *   <li><b>Filter:</b> keep the files whose content changed since the last build, plus
 *       every file that transitively depends on one of them. Unchanged files reuse their
 *       cached validation result.</li>
 *   <li><b>Generate, Validate, Test:</b> per changed file, on a bounded worker pool.
 *       Every adapter call is bounded by the call timeout and the build deadline; a
 *       failure or timeout is recorded against that file only.</li>
 *   <li><b>Persist:</b> record each processed file in the change tracker.</li>
 *   <li><b>Render:</b> write the API pages of processed files. Failures are logged.</li>
 *   <li><b>Report:</b> emit build reports. Failures propagate.</li>
 *   <li><b>Aggregate:</b> fold everything into one {@link BuildResult}.</li>
 * </ol>
 *
 * <p>The orchestrator owns the transient workspace; callers must invoke
 * {@link #cleanup()} when done, typically in a {@code finally} block. The change tracker
 * is injected and stays owned by the caller.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BuildOrchestrator orchestrator = BuildOrchestrator.builder()
 *     .tracker(tracker)
 *     .workspace(workspace)
 *     .sourceSync(RoutingSourceSync.defaults())
 *     .discovery(CompositeUnitDiscovery.loadInstalled())
 *     .generator(generator)
 *     .validator(validator)
 *     .testExecutor(executor)
 *     .reportEmitter(emitter)
 *     .build();
 * try {
 *     BuildResult result = orchestrator.build(config.repositories());
 * } finally {
 *     orchestrator.cleanup();
 * }
 * }</pre>
 */
public class BuildOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    private final ChangeTracker tracker;
    private final BuildWorkspace workspace;
    private final SourceSync sourceSync;
    private final UnitDiscovery discovery;
    private final ExampleGenerator generator;
    private final DocValidator validator;
    private final TestExecutor testExecutor;
    private final ReportEmitter reportEmitter;
    private final OutputRenderer pageRenderer;
    private final Path docsDirectory;
    private final BuildOptions options;

    private BuildOrchestrator(Builder builder) {
        this.tracker = Objects.requireNonNull(builder.tracker, "tracker must not be null");
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace must not be null");
        this.sourceSync = Objects.requireNonNull(builder.sourceSync, "sourceSync must not be null");
        this.discovery = Objects.requireNonNull(builder.discovery, "discovery must not be null");
        this.generator = Objects.requireNonNull(builder.generator, "generator must not be null");
        this.validator = Objects.requireNonNull(builder.validator, "validator must not be null");
        this.testExecutor = Objects.requireNonNull(builder.testExecutor, "testExecutor must not be null");
        this.reportEmitter = Objects.requireNonNull(builder.reportEmitter, "reportEmitter must not be null");
        this.pageRenderer = builder.pageRenderer;
        this.docsDirectory = builder.docsDirectory;
        this.options = builder.options;
        if (!tracker.unitRoot().equals(workspace.root())) {
            log.warn("Change tracker root {} differs from workspace {}; cache keys will not be stable",
                tracker.unitRoot(), workspace.root());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Build ====================

    /**
     * Runs one build over the given sources.
     *
     * @param repos sources to document
     * @return aggregated result
     * @throws ReportEmissionException if the build reports cannot be written
     */
    public BuildResult build(List<RepoConfig> repos) {
        Deadline deadline = Deadline.after(options.buildTimeout());
        log.info("Starting build of {} source(s)", repos.size());

        List<SourceOutcome> sources = acquire(repos);

        Map<Path, TrackedFile> files;
        try {
            files = discover(sources);
        } catch (DiscoveryException | RuntimeException e) {
            log.error("Discovery failed: {}", e.getMessage());
            return BuildResult.aborted("Discovery failed: " + e.getMessage(), sources);
        }

        Set<Path> changed = filter(files);
        List<FileOutcome> outcomes = process(files, changed, deadline);
        List<UnitOutcome> units = outcomes.stream().map(FileOutcome::outcome).toList();

        renderPages(outcomes);
        BuildResult result = aggregate(sources, units);
        emitReports(sources, units, result.validationPassed());

        log.info("Build finished: validation {}, tests {}, {} of {} files reprocessed",
            result.validationPassed() ? "passed" : "failed",
            result.testsPassed() ? "passed" : "failed",
            result.reprocessedCount(), units.size());
        return result;
    }

    /**
     * Computes which files a build would reprocess, without processing them.
     *
     * @param repos sources to inspect
     * @return build plan
     */
    public BuildPlan plan(List<RepoConfig> repos) {
        List<SourceOutcome> sources = acquire(repos);
        Map<Path, TrackedFile> files;
        try {
            files = discover(sources);
        } catch (DiscoveryException | RuntimeException e) {
            log.error("Discovery failed: {}", e.getMessage());
            return new BuildPlan(sources, List.of(), List.of(), "Discovery failed: " + e.getMessage());
        }

        Set<Path> changed = filter(files);
        List<String> changedIds = new ArrayList<>();
        List<String> unchangedIds = new ArrayList<>();
        for (TrackedFile file : files.values()) {
            (changed.contains(file.path) ? changedIds : unchangedIds).add(file.identifier);
        }
        return new BuildPlan(sources, changedIds, unchangedIds, null);
    }

    public Path workspaceRoot() {
        return workspace.root();
    }

    /**
     * Removes the transient workspace. Idempotent; never touches the cache or the
     * permanent output directories.
     */
    public void cleanup() {
        workspace.cleanup();
    }

    // ==================== Acquire ====================

    private List<SourceOutcome> acquire(List<RepoConfig> repos) {
        List<SourceOutcome> outcomes = new ArrayList<>();
        Set<String> usedSlugs = new HashSet<>();
        for (RepoConfig repo : repos) {
            String slug = slugFor(repo, usedSlugs);
            Path directory = workspace.root().resolve(slug);
            try {
                directory = workspace.prepareSourceDirectory(slug);
                sourceSync.sync(repo, directory);
                log.info("Synced {} into {}", repo.displayName(), directory);
                outcomes.add(SourceOutcome.synced(repo, directory));
            } catch (SyncException | IOException | RuntimeException e) {
                log.warn("Failed to sync {}: {}", repo.displayName(), e.getMessage());
                outcomes.add(SourceOutcome.failed(repo, directory, e.getMessage()));
            }
        }
        return outcomes;
    }

    static String slugFor(RepoConfig repo, Set<String> used) {
        String base = repo.displayName().replaceAll("[^A-Za-z0-9._-]", "-");
        if (base.isBlank() || base.chars().allMatch(c -> c == '.')) {
            base = "source";
        }
        String slug = base;
        int suffix = 2;
        while (!used.add(slug)) {
            slug = base + "-" + suffix++;
        }
        return slug;
    }

    // ==================== Discover & Filter ====================

    private Map<Path, TrackedFile> discover(List<SourceOutcome> sources) throws DiscoveryException {
        Map<Path, TrackedFile> files = new LinkedHashMap<>();
        for (SourceOutcome source : sources) {
            if (!source.synced()) {
                continue;
            }
            List<Path> restrictions = source.repo().paths().stream().map(Path::of).toList();
            List<DocumentableUnit> units = discovery.discover(source.directory(), restrictions);
            for (DocumentableUnit unit : units) {
                Path file = unit.sourcePath().toAbsolutePath().normalize();
                if (!FileUtils.isWithin(source.directory(), file)) {
                    log.warn("Ignoring unit {} outside of source {}", unit.qualifiedName(), source.directory());
                    continue;
                }
                files.computeIfAbsent(file, path -> new TrackedFile(path, tracker.identifierOf(path),
                    source.directory(), testRootFor(path, source.directory(), restrictions))).units.add(unit);
            }
        }
        log.info("Discovered {} units in {} files",
            files.values().stream().mapToInt(file -> file.units.size()).sum(), files.size());
        return files;
    }

    /**
     * Returns the directory module names of a file are relative to: the restricted path
     * containing it, or the source directory.
     */
    private static Path testRootFor(Path file, Path sourceDirectory, List<Path> restrictions) {
        for (Path restriction : restrictions) {
            Path base = sourceDirectory.resolve(restriction).normalize();
            if (Files.isRegularFile(base)) {
                base = base.getParent();
            }
            if (file.startsWith(base)) {
                return base;
            }
        }
        return sourceDirectory;
    }

    private Set<Path> filter(Map<Path, TrackedFile> files) {
        Set<Path> changed = new LinkedHashSet<>(tracker.getChangedUnits(new ArrayList<>(files.keySet())));
        Set<Path> dependents = new LinkedHashSet<>();
        for (Path file : changed) {
            for (Path dependent : tracker.getDependents(file)) {
                Path normalized = dependent.toAbsolutePath().normalize();
                if (files.containsKey(normalized) && !changed.contains(normalized)) {
                    dependents.add(normalized);
                }
            }
        }
        changed.addAll(dependents);
        log.info("{} of {} files need processing ({} as dependents of changed files)",
            changed.size(), files.size(), dependents.size());
        return changed;
    }

    // ==================== Process ====================

    private List<FileOutcome> process(Map<Path, TrackedFile> files, Set<Path> changed, Deadline deadline) {
        ExecutorService workers = Executors.newFixedThreadPool(options.workers(), daemonThreads("docforge-worker-"));
        ExecutorService calls = Executors.newCachedThreadPool(daemonThreads("docforge-call-"));
        try {
            Map<Path, Future<FileOutcome>> futures = new LinkedHashMap<>();
            for (TrackedFile file : files.values()) {
                if (changed.contains(file.path)) {
                    futures.put(file.path, workers.submit(() -> processFile(file, deadline, calls)));
                }
            }

            List<FileOutcome> outcomes = new ArrayList<>();
            for (TrackedFile file : files.values()) {
                Future<FileOutcome> future = futures.get(file.path);
                outcomes.add(future == null ? cachedOutcome(file) : await(future, file));
            }
            return outcomes;
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
        }
    }

    private FileOutcome cachedOutcome(TrackedFile file) {
        boolean cachedResult = tracker.stateOf(file.identifier)
            .map(TrackedUnitState::lastValidationResult)
            .orElse(false);
        log.debug("{}: unchanged, reusing cached result ({})", file.identifier, cachedResult ? "valid" : "invalid");
        return new FileOutcome(UnitOutcome.cached(file.identifier, file.path, file.units, cachedResult), null);
    }

    private FileOutcome await(Future<FileOutcome> future, TrackedFile file) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Processing of {} failed: {}", file.identifier, cause.getMessage(), cause);
            return failedOutcome(file, "Processing failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failedOutcome(file, "Interrupted while processing " + file.identifier);
        }
    }

    private static FileOutcome failedOutcome(TrackedFile file, String message) {
        return new FileOutcome(new UnitOutcome(file.identifier, file.path, file.units, List.of(),
            ValidationVerdict.failed(message), List.of(), List.of(), true), null);
    }

    private FileOutcome processFile(TrackedFile file, Deadline deadline, ExecutorService calls) {
        try (UnitMdc ignored = UnitMdc.enter(file.identifier)) {
            if (deadline.expired()) {
                log.warn("Build deadline exceeded, skipping {}", file.identifier);
                tracker.invalidate(file.path);
                return failedOutcome(file, "Build deadline exceeded before " + file.identifier + " was processed");
            }
            log.info("Processing {} ({} units)", file.identifier, file.units.size());

            Map<DocumentableUnit, List<GeneratedArtifact>> artifacts = new LinkedHashMap<>();
            List<String> generationErrors = new ArrayList<>();
            for (DocumentableUnit unit : file.units) {
                CallResult<List<GeneratedArtifact>> generated =
                    call("Generation for " + unit.qualifiedName(), () -> generator.generate(unit), deadline, calls);
                if (!generated.isSuccess()) {
                    generationErrors.add(unit.qualifiedName() + ": " + generated.message());
                }
                List<GeneratedArtifact> produced = generated.orElse(List.of());
                artifacts.put(unit, produced == null ? List.of() : produced);
            }

            String page = ApiPageGenerator.page(file.identifier, file.units, artifacts);
            CallResult<ValidationVerdict> validation = validate(file, page, deadline, calls);
            ValidationVerdict verdict = validation.isSuccess()
                ? validation.value()
                : ValidationVerdict.failed(validation.message());
            List<TestRun> testRuns = runTests(file, artifacts, deadline, calls);
            if (validation.isSuccess()) {
                persist(file, verdict);
            } else {
                log.warn("{}: no verdict delivered, dropping its cache entry so the next build retries", file.identifier);
                tracker.invalidate(file.path);
            }

            List<GeneratedArtifact> allArtifacts = artifacts.values().stream().flatMap(List::stream).toList();
            return new FileOutcome(new UnitOutcome(file.identifier, file.path, file.units, allArtifacts,
                verdict, testRuns, generationErrors, true), page);
        }
    }

    /**
     * Validates the rendered page against the file's source. A successful result carries the
     * verdict the validator delivered. Any other result is transient: the file's cache entry is
     * dropped instead of updated.
     */
    private CallResult<ValidationVerdict> validate(TrackedFile file, String page, Deadline deadline,
                                                   ExecutorService calls) {
        String source;
        try {
            source = Files.readString(file.path);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file.identifier, e.getMessage());
            return CallResult.failed("Failed to read source " + file.identifier + ": " + e.getMessage());
        }

        CallResult<ValidationVerdict> result = call("Validation of " + file.identifier,
            () -> validator.validate(new ValidationRequest(source, page)), deadline, calls);
        if (!result.isSuccess()) {
            return result;
        }
        if (result.value() == null) {
            return CallResult.failed("Validation of " + file.identifier + " returned no verdict");
        }
        ValidationVerdict verdict = result.value();
        if (!verdict.valid()) {
            log.warn("{} failed validation: {}", file.identifier, verdict.firstError());
        }
        return result;
    }

    private List<TestRun> runTests(TrackedFile file, Map<DocumentableUnit, List<GeneratedArtifact>> artifacts,
                                   Deadline deadline, ExecutorService calls) {
        List<TestRun> runs = new ArrayList<>();
        for (Map.Entry<DocumentableUnit, List<GeneratedArtifact>> entry : artifacts.entrySet()) {
            DocumentableUnit unit = entry.getKey();
            if (!testExecutor.supports(unit)) {
                log.debug("No test executor for {} ({})", unit.qualifiedName(), unit.language());
                continue;
            }
            for (GeneratedArtifact artifact : entry.getValue()) {
                if (!artifact.hasTest()) {
                    continue;
                }
                CallResult<TestOutcome> result = call("Test of " + unit.qualifiedName(),
                    () -> testExecutor.execute(artifact, unit, file.testRoot), deadline, calls);
                TestOutcome outcome = result.isSuccess() && result.value() != null
                    ? result.value()
                    : TestOutcome.failure(result.isSuccess() ? "Test executor returned no outcome" : result.message());
                if (!outcome.passed()) {
                    log.warn("Test failed for {}: {}", unit.qualifiedName(), outcome.errorMessage());
                }
                runs.add(new TestRun(unit.name(), artifact.description(), outcome));
            }
        }
        return runs;
    }

    private void persist(TrackedFile file, ValidationVerdict verdict) {
        try {
            List<String> dependencies = discovery.dependenciesOf(file.path, file.sourceDirectory).stream()
                .map(tracker::identifierOf)
                .toList();
            tracker.updateState(file.path, dependencies, verdict.valid());
        } catch (RuntimeException e) {
            log.error("Failed to record cache state for {}: {}", file.identifier, e.getMessage());
        }
    }

    /**
     * Runs one adapter call, bounded by the call timeout and the build deadline.
     */
    private <T> CallResult<T> call(String what, Callable<T> action, Deadline deadline, ExecutorService calls) {
        Duration budget = deadline.budgetFor(options.callTimeout());
        if (budget.isZero()) {
            log.warn("{} skipped: build deadline exceeded", what);
            return CallResult.timeout(what + " skipped: build deadline exceeded");
        }

        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<T> future = calls.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return action.call();
            } finally {
                MDC.clear();
            }
        });

        try {
            return CallResult.ok(future.get(budget.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("{} timed out after {} ms", what, budget.toMillis());
            return CallResult.timeout(what + " timed out after " + budget.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("{} failed: {}", what, cause.getMessage());
            return CallResult.failed(what + " failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CallResult.failed(what + " interrupted");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ==================== Render, Report, Aggregate ====================

    private void renderPages(List<FileOutcome> outcomes) {
        if (pageRenderer == null || docsDirectory == null) {
            return;
        }
        try {
            List<GeneratedFile> pages = new ArrayList<>();
            for (FileOutcome outcome : outcomes) {
                if (outcome.page() != null) {
                    pages.add(GeneratedFile.markdown(ApiPageGenerator.pagePath(outcome.outcome().identifier()),
                        outcome.page()));
                }
            }
            pages.add(ApiPageGenerator.index(options.projectName(),
                outcomes.stream().map(outcome -> outcome.outcome().identifier()).toList()));
            pageRenderer.render(new GeneratedOutput(pages), RenderContext.of(docsDirectory));
        } catch (RuntimeException e) {
            log.error("Failed to render API pages to {}: {}", docsDirectory, e.getMessage());
        }
    }

    private void emitReports(List<SourceOutcome> sources, List<UnitOutcome> units, boolean validationPassed) {
        BuildReport report = BuildReport.of(options.projectName(), options.projectVersion(), sources, units,
            validationPassed);
        try {
            reportEmitter.emit(report);
        } catch (ReportEmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReportEmissionException("Report emission failed: " + e.getMessage(), e);
        }
    }

    static BuildResult aggregate(List<SourceOutcome> sources, List<UnitOutcome> units) {
        boolean sourcesSynced = sources.stream().allMatch(SourceOutcome::synced);
        boolean validationPassed = sourcesSynced && units.stream().allMatch(UnitOutcome::validationPassed);
        boolean testsPassed = units.stream().allMatch(UnitOutcome::testsPassed);
        return new BuildResult(validationPassed, testsPassed, firstError(sources, units), sources, units);
    }

    private static String firstError(List<SourceOutcome> sources, List<UnitOutcome> units) {
        Optional<String> sourceError = sources.stream()
            .filter(source -> !source.synced())
            .map(source -> "Failed to sync " + source.repo().displayName() + ": " + source.errorMessage())
            .findFirst();
        if (sourceError.isPresent()) {
            return sourceError.get();
        }
        return units.stream()
            .filter(unit -> !unit.validationPassed())
            .map(unit -> unit.verdict().firstError())
            .findFirst()
            .orElse(null);
    }

    // ==================== Internal types ====================

    /**
     * A source file holding at least one discovered unit.
     */
    private static final class TrackedFile {
        private final Path path;
        private final String identifier;
        private final Path sourceDirectory;
        private final Path testRoot;
        private final List<DocumentableUnit> units = new ArrayList<>();

        private TrackedFile(Path path, String identifier, Path sourceDirectory, Path testRoot) {
            this.path = path;
            this.identifier = identifier;
            this.sourceDirectory = sourceDirectory;
            this.testRoot = testRoot;
        }
    }

    private record FileOutcome(UnitOutcome outcome, String page) {}

    /**
     * Builder for {@link BuildOrchestrator}.
     */
    public static final class Builder {
        private ChangeTracker tracker;
        private BuildWorkspace workspace;
        private SourceSync sourceSync;
        private UnitDiscovery discovery;
        private ExampleGenerator generator;
        private DocValidator validator;
        private TestExecutor testExecutor;
        private ReportEmitter reportEmitter;
        private OutputRenderer pageRenderer;
        private Path docsDirectory;
        private BuildOptions options = BuildOptions.defaults();

        private Builder() {
        }

        public Builder tracker(ChangeTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder workspace(BuildWorkspace workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder sourceSync(SourceSync sourceSync) {
            this.sourceSync = sourceSync;
            return this;
        }

        public Builder discovery(UnitDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder generator(ExampleGenerator generator) {
            this.generator = generator;
            return this;
        }

        public Builder validator(DocValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder testExecutor(TestExecutor testExecutor) {
            this.testExecutor = testExecutor;
            return this;
        }

        public Builder reportEmitter(ReportEmitter reportEmitter) {
            this.reportEmitter = reportEmitter;
            return this;
        }

        /**
         * Enables the render stage.
         *
         * @param renderer renderer the pages are written with
         * @param directory permanent docs directory
         * @return this builder
         */
        public Builder pages(OutputRenderer renderer, Path directory) {
            this.pageRenderer = renderer;
            this.docsDirectory = directory;
            return this;
        }

        public Builder options(BuildOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public BuildOrchestrator build() {
            return new BuildOrchestrator(this);
        }
    }
}
