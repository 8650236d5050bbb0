package com.docforge.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file produced by the pipeline, waiting to be written by an {@link OutputRenderer}.
 *
 * <p>The relative path must stay inside the render target: absolute paths and
 * {@code ..} segments that escape it are rejected.
 *
 * @param relativePath path relative to the render target (e.g. {@code "sdk/client.md"})
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String MARKDOWN = "text/markdown";
    public static final String JSON = "application/json";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Path path = Path.of(relativePath).normalize();
        if (path.isAbsolute() || path.startsWith("..") || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must stay inside the output directory: " + relativePath);
        }
        if (contentType == null) {
            contentType = MARKDOWN;
        }
    }

    public static GeneratedFile markdown(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, MARKDOWN);
    }

    public static GeneratedFile json(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, JSON);
    }
}
