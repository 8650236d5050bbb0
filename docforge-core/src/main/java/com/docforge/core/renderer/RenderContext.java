package com.docforge.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Target of one render pass.
 *
 * @param outputDirectory directory files are written under
 */
public record RenderContext(
    Path outputDirectory
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory);
    }
}
