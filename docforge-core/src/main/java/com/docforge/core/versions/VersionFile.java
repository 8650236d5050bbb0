package com.docforge.core.versions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted form of the recorded SDK versions.
 *
 * @param versions last seen version per package name
 * @param lastChecked ISO-8601 instant of the check that wrote the file, null if never checked
 */
public record VersionFile(
    @JsonProperty("versions") Map<String, String> versions,
    @JsonProperty("last_checked") String lastChecked
) {
    @JsonCreator
    public VersionFile {
        versions = versions == null ? Map.of() : new TreeMap<>(versions);
    }

    public static VersionFile empty() {
        return new VersionFile(Map.of(), null);
    }
}
