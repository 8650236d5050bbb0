package com.docforge.core.config;

import com.docforge.core.model.RepoConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for DocForge builds.
 *
 * <p>Loaded from {@code docforge.yaml}. Every section is optional; absent sections and
 * fields fall back to the defaults exposed by the accessor methods.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "My SDK"
 *   version: "1.0.0"
 *
 * repositories:
 *   - name: sdk
 *     location: https://github.com/acme/sdk.git
 *     paths: [src]
 *
 * cache:
 *   file: .cache/build_state.json
 *
 * output:
 *   docsDirectory: docs/api
 *   reportsDirectory: docs/reports
 *
 * execution:
 *   workers: 4
 *   callTimeoutSeconds: 120
 *   buildTimeoutMinutes: 30
 * }</pre>
 *
 * @param project project metadata
 * @param repositories sources to document
 * @param workspace transient workspace settings
 * @param cache change tracker settings
 * @param output permanent output locations
 * @param generation generative model settings
 * @param execution concurrency and timeout settings
 * @param testing test runner settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("repositories") List<RepoConfig> repositories,
    @JsonProperty("workspace") WorkspaceConfig workspace,
    @JsonProperty("cache") CacheConfig cache,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("generation") GenerationConfig generation,
    @JsonProperty("execution") ExecutionConfig execution,
    @JsonProperty("testing") TestingConfig testing
) {
    /**
     * Compact constructor filling absent sections with their defaults.
     */
    public PipelineConfig {
        project = project == null ? new ProjectInfo("project", "1.0.0") : project;
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
        workspace = workspace == null ? new WorkspaceConfig(null) : workspace;
        cache = cache == null ? new CacheConfig(null) : cache;
        output = output == null ? new OutputConfig(null, null) : output;
        generation = generation == null ? new GenerationConfig(null, null, null) : generation;
        execution = execution == null ? new ExecutionConfig(null, null, null) : execution;
        testing = testing == null ? new TestingConfig(null, null, null) : testing;
    }

    /**
     * Creates a default configuration that documents the current directory.
     *
     * @return default configuration
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(null, List.of(new RepoConfig("main", ".", List.of())), null, null, null, null, null, null);
    }

    /**
     * Lists configuration problems that would prevent a build from running.
     *
     * @return problem descriptions, empty when the configuration is usable
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (repositories.isEmpty()) {
            problems.add("No repositories configured");
        }
        for (int i = 0; i < repositories.size(); i++) {
            RepoConfig repo = repositories.get(i);
            if (repo.location().isBlank()) {
                problems.add("Repository #" + (i + 1) + " has a blank location");
            }
            for (String path : repo.paths()) {
                if (Path.of(path).isAbsolute() || Path.of(path).normalize().startsWith("..")) {
                    problems.add("Repository '" + repo.displayName() + "' path escapes the source root: " + path);
                }
            }
        }
        if (execution.workers() < 1) {
            problems.add("execution.workers must be positive");
        }
        if (execution.callTimeoutSeconds() < 1) {
            problems.add("execution.callTimeoutSeconds must be positive");
        }
        if (execution.buildTimeoutMinutes() < 1) {
            problems.add("execution.buildTimeoutMinutes must be positive");
        }
        if (testing.timeoutSeconds() < 1) {
            problems.add("testing.timeoutSeconds must be positive");
        }
        if (testing.command().isEmpty()) {
            problems.add("testing.command must not be empty");
        }
        return problems;
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {}

    /**
     * Transient workspace settings.
     *
     * @param directory fixed workspace directory, or null for a fresh temporary directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkspaceConfig(
        @JsonProperty("directory") String directory
    ) {}

    /**
     * Change tracker settings.
     *
     * @param file cache file location
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheConfig(
        @JsonProperty("file") String file
    ) {
        public CacheConfig {
            file = file == null || file.isBlank() ? ".cache/build_state.json" : file;
        }
    }

    /**
     * Permanent output locations.
     *
     * @param docsDirectory directory rendered API pages are written to
     * @param reportsDirectory directory build reports are written to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("docsDirectory") String docsDirectory,
        @JsonProperty("reportsDirectory") String reportsDirectory
    ) {
        public OutputConfig {
            docsDirectory = docsDirectory == null || docsDirectory.isBlank() ? "docs/api" : docsDirectory;
            reportsDirectory = reportsDirectory == null || reportsDirectory.isBlank() ? "docs/reports" : reportsDirectory;
        }
    }

    /**
     * Generative model settings.
     *
     * @param model model name
     * @param maxTokens response token limit
     * @param temperature sampling temperature
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationConfig(
        @JsonProperty("model") String model,
        @JsonProperty("maxTokens") Integer maxTokens,
        @JsonProperty("temperature") Double temperature
    ) {
        public GenerationConfig {
            model = model == null || model.isBlank() ? "claude-3-5-sonnet-20241022" : model;
            maxTokens = maxTokens == null ? 4096 : maxTokens;
            temperature = temperature == null ? 0.0 : temperature;
        }
    }

    /**
     * Concurrency and timeout settings.
     *
     * @param workers size of the unit worker pool
     * @param callTimeoutSeconds timeout for a single adapter call
     * @param buildTimeoutMinutes overall build deadline
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExecutionConfig(
        @JsonProperty("workers") Integer workers,
        @JsonProperty("callTimeoutSeconds") Integer callTimeoutSeconds,
        @JsonProperty("buildTimeoutMinutes") Integer buildTimeoutMinutes
    ) {
        public ExecutionConfig {
            workers = workers == null ? 4 : workers;
            callTimeoutSeconds = callTimeoutSeconds == null ? 120 : callTimeoutSeconds;
            buildTimeoutMinutes = buildTimeoutMinutes == null ? 30 : buildTimeoutMinutes;
        }

        public Duration callTimeout() {
            return Duration.ofSeconds(callTimeoutSeconds);
        }

        public Duration buildTimeout() {
            return Duration.ofMinutes(buildTimeoutMinutes);
        }
    }

    /**
     * Test runner settings.
     *
     * @param command runner command; the generated test file is appended
     * @param timeoutSeconds timeout for one test run
     * @param extensions source file extensions whose units get tests executed
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestingConfig(
        @JsonProperty("command") List<String> command,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("extensions") List<String> extensions
    ) {
        public TestingConfig {
            command = command == null ? List.of("python", "-m", "pytest", "-q") : List.copyOf(command);
            timeoutSeconds = timeoutSeconds == null ? 120 : timeoutSeconds;
            extensions = extensions == null || extensions.isEmpty() ? List.of("py") : List.copyOf(extensions);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }
}
