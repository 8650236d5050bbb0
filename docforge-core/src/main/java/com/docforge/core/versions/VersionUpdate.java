package com.docforge.core.versions;

/**
 * A package whose latest release differs from the recorded one.
 *
 * @param packageName package name
 * @param current recorded version, null if the package was never recorded
 * @param latest latest released version
 */
public record VersionUpdate(String packageName, String current, String latest) {

    public boolean isFirstSighting() {
        return current == null;
    }

    @Override
    public String toString() {
        return packageName + ": " + (current == null ? "(untracked)" : current) + " -> " + latest;
    }
}
