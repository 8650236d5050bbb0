package com.docforge.core.pipeline;

import com.docforge.core.model.SourceOutcome;

import java.util.List;

/**
 * What a build would do, computed without generating, validating or writing anything.
 *
 * @param sources per-source acquisition outcomes
 * @param changed identifiers of files that would be reprocessed
 * @param unchanged identifiers of files whose cached result would be reused
 * @param errorMessage discovery failure, or null
 */
public record BuildPlan(
    List<SourceOutcome> sources,
    List<String> changed,
    List<String> unchanged,
    String errorMessage
) {
    /**
     * Compact constructor with validation.
     */
    public BuildPlan {
        sources = sources == null ? List.of() : List.copyOf(sources);
        changed = changed == null ? List.of() : List.copyOf(changed);
        unchanged = unchanged == null ? List.of() : List.copyOf(unchanged);
    }

    public boolean isUpToDate() {
        return errorMessage == null && changed.isEmpty();
    }
}
