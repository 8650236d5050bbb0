package com.docforge.core.validation;

import java.util.Objects;

/**
 * Documentation to check against the source it describes.
 *
 * @param source source code of the file
 * @param documentation rendered documentation for the file's units
 */
public record ValidationRequest(
    String source,
    String documentation
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationRequest {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(documentation, "documentation must not be null");
    }
}
