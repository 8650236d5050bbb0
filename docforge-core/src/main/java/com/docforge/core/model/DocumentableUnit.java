package com.docforge.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A documentable API element discovered in a source tree.
 *
 * <p>Produced by a {@link com.docforge.core.discovery.UnitDiscovery} and consumed by
 * example generation. Lives only for the duration of one build.
 *
 * @param name function or method name
 * @param module enclosing module (dotted Python module, or Java package plus type)
 * @param docstring documentation comment, or null when the element has none
 * @param signature human-readable signature, e.g. {@code greet(name, punctuation)}
 * @param sourcePath file the element was found in
 * @param parameters parameter names in declaration order
 * @param returnType declared return type, or null when unknown
 */
public record DocumentableUnit(
    String name,
    String module,
    String docstring,
    String signature,
    Path sourcePath,
    List<String> parameters,
    String returnType
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentableUnit {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        if (module == null) {
            module = "";
        }
        if (signature == null || signature.isBlank()) {
            signature = name + "()";
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Creates a unit without parameter or return type details.
     */
    public static DocumentableUnit of(String name, String module, String docstring, String signature, Path sourcePath) {
        return new DocumentableUnit(name, module, docstring, signature, sourcePath, List.of(), null);
    }

    /**
     * Returns the module-qualified name, e.g. {@code sdk.client.greet}.
     *
     * @return qualified name
     */
    public String qualifiedName() {
        return module.isEmpty() ? name : module + "." + name;
    }

    /**
     * Returns true if the unit carries a non-blank docstring.
     *
     * @return true if documented in source
     */
    public boolean hasDocstring() {
        return docstring != null && !docstring.isBlank();
    }

    /**
     * Returns the source file extension without the dot, lower-cased.
     *
     * @return extension such as {@code py} or {@code java}
     */
    public String language() {
        String fileName = sourcePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(java.util.Locale.ROOT) : "";
    }
}
