package com.docforge.core.pipeline;

import com.docforge.core.config.PipelineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the build orchestrator.
 *
 * @param workers number of files processed concurrently
 * @param callTimeout timeout of a single adapter call
 * @param buildTimeout deadline of the whole build
 * @param projectName project name used in reports
 * @param projectVersion project version used in reports
 */
public record BuildOptions(
    int workers,
    Duration callTimeout,
    Duration buildTimeout,
    String projectName,
    String projectVersion
) {
    /**
     * Compact constructor with validation.
     */
    public BuildOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        Objects.requireNonNull(buildTimeout, "buildTimeout must not be null");
        if (callTimeout.isNegative() || callTimeout.isZero() || buildTimeout.isNegative() || buildTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        projectName = projectName == null ? "project" : projectName;
        projectVersion = projectVersion == null ? "1.0.0" : projectVersion;
    }

    public static BuildOptions defaults() {
        return new BuildOptions(4, Duration.ofSeconds(120), Duration.ofMinutes(30), null, null);
    }

    public static BuildOptions from(PipelineConfig config) {
        return new BuildOptions(
            config.execution().workers(),
            config.execution().callTimeout(),
            config.execution().buildTimeout(),
            config.project().name(),
            config.project().version()
        );
    }
}
