package com.docforge.core.versions;

import java.util.Objects;

/**
 * An SDK package whose releases are monitored.
 *
 * @param registry registry the package is published to
 * @param name package name in that registry
 */
public record TrackedPackage(PackageRegistry registry, String name) {

    public TrackedPackage {
        Objects.requireNonNull(registry, "registry must not be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Package name must not be blank");
        }
    }

    public static TrackedPackage pypi(String name) {
        return new TrackedPackage(PackageRegistry.PYPI, name);
    }

    public static TrackedPackage npm(String name) {
        return new TrackedPackage(PackageRegistry.NPM, name);
    }
}
