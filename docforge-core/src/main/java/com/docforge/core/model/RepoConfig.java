package com.docforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One configured documentation source.
 *
 * <p>Supplied at build start and immutable for the duration of the build.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * repositories:
 *   - name: sdk
 *     location: https://github.com/acme/sdk.git
 *     paths: [src]
 * }</pre>
 *
 * @param name optional display name, also used for the workspace directory
 * @param location git URL or local directory
 * @param paths optional restriction to paths within the source, relative to its root
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoConfig(
    @JsonProperty("name") String name,
    @JsonProperty("location") String location,
    @JsonProperty("paths") List<String> paths
) {
    /**
     * Compact constructor with validation.
     */
    public RepoConfig {
        Objects.requireNonNull(location, "location must not be null");
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    /**
     * Creates an unrestricted source.
     *
     * @param location git URL or local directory
     * @return repository config
     */
    public static RepoConfig of(String location) {
        return new RepoConfig(null, location, List.of());
    }

    /**
     * Returns the configured name, or one derived from the location
     * ({@code https://host/acme/sdk.git} becomes {@code sdk}).
     *
     * @return display name
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        String trimmed = location.replaceAll("[/\\\\]+$", "");
        int slash = Math.max(trimmed.lastIndexOf('/'), Math.max(trimmed.lastIndexOf('\\'), trimmed.lastIndexOf(':')));
        String last = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        if (last.endsWith(".git")) {
            last = last.substring(0, last.length() - 4);
        }
        return last.isBlank() ? "source" : last;
    }

    public boolean isRestricted() {
        return !paths.isEmpty();
    }
}
