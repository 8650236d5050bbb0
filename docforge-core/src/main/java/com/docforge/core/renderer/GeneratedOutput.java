package com.docforge.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Set of files rendered together in one pass.
 *
 * @param files files to render, in write order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }

    /**
     * Returns a new output holding this output's files followed by the other's.
     *
     * @param other files to append
     * @return combined output
     */
    public GeneratedOutput plus(GeneratedOutput other) {
        List<GeneratedFile> combined = new ArrayList<>(files);
        combined.addAll(other.files());
        return new GeneratedOutput(combined);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
