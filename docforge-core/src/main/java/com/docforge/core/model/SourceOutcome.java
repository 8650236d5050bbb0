package com.docforge.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of acquiring one configured source into the workspace.
 *
 * @param repo the configured source
 * @param directory workspace directory the source was synced into
 * @param synced whether the sync succeeded
 * @param errorMessage sync failure, or null
 */
public record SourceOutcome(
    RepoConfig repo,
    Path directory,
    boolean synced,
    String errorMessage
) {
    /**
     * Compact constructor with validation.
     */
    public SourceOutcome {
        Objects.requireNonNull(repo, "repo must not be null");
        Objects.requireNonNull(directory, "directory must not be null");
    }

    public static SourceOutcome synced(RepoConfig repo, Path directory) {
        return new SourceOutcome(repo, directory, true, null);
    }

    public static SourceOutcome failed(RepoConfig repo, Path directory, String errorMessage) {
        return new SourceOutcome(repo, directory, false, errorMessage);
    }
}
