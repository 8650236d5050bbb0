package com.docforge.core.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Cached state of one tracked unit.
 *
 * <p>Dependencies have set semantics: they are de-duplicated and kept sorted so that
 * equal sets compare equal and serialize identically.
 *
 * @param contentHash SHA-256 hex digest of the unit's content when last processed
 * @param dependencies identifiers of units this unit's correctness depends on
 * @param lastValidationResult outcome of the most recent validation pass
 */
public record TrackedUnitState(
    @JsonProperty("contentHash") String contentHash,
    @JsonProperty("dependencies") List<String> dependencies,
    @JsonProperty("lastValidationResult") boolean lastValidationResult
) {
    /**
     * Compact constructor with validation.
     */
    @JsonCreator
    public TrackedUnitState {
        Objects.requireNonNull(contentHash, "contentHash must not be null");
        dependencies = normalize(dependencies);
    }

    private static List<String> normalize(Collection<String> dependencies) {
        if (dependencies == null) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String dependency : dependencies) {
            if (dependency != null && !dependency.isBlank()) {
                sorted.add(dependency);
            }
        }
        return List.copyOf(sorted);
    }
}
