package com.docforge.core.versions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Watches SDK packages for new releases.
 *
 * <p>The last seen version of each package is kept in a JSON file of the form
 * <pre>{@code
 * {
 *   "last_checked" : "2024-05-01T12:00:00Z",
 *   "versions" : { "anthropic" : "0.25.0" }
 * }
 * }</pre>
 * A release is reported when the registry's latest version differs from the recorded one,
 * including the first time a package is seen. A package that cannot be looked up is
 * reported as a failure and keeps its recorded version.
 */
public class VersionMonitor {

    private static final Logger log = LoggerFactory.getLogger(VersionMonitor.class);

    public static final Path DEFAULT_VERSIONS_FILE = Paths.get("config", "sdk_versions.json");

    public static final List<TrackedPackage> DEFAULT_PACKAGES = List.of(
        TrackedPackage.pypi("anthropic"),
        TrackedPackage.npm("@anthropic-ai/sdk"));

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path versionsFile;
    private final MetadataFetcher fetcher;
    private final Clock clock;

    public VersionMonitor(Path versionsFile, MetadataFetcher fetcher, Clock clock) {
        this.versionsFile = Objects.requireNonNull(versionsFile, "versionsFile must not be null").toAbsolutePath();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path versionsFile() {
        return versionsFile;
    }

    /**
     * Reads the recorded versions.
     *
     * <p>A missing file yields an empty record. An unreadable one is logged and also yields
     * an empty record, so every package is reported again.
     *
     * @return recorded versions
     */
    public VersionFile load() {
        if (!Files.exists(versionsFile)) {
            log.debug("No versions file at {}", versionsFile);
            return VersionFile.empty();
        }
        try {
            VersionFile loaded = JSON.readValue(versionsFile.toFile(), VersionFile.class);
            return loaded == null ? VersionFile.empty() : loaded;
        } catch (IOException e) {
            log.warn("Failed to read versions file {}, treating every package as untracked: {}",
                versionsFile, e.getMessage());
            return VersionFile.empty();
        }
    }

    /**
     * Looks up the latest release of a package.
     *
     * @param trackedPackage package to look up
     * @return latest version
     * @throws IOException if the registry cannot be reached or its answer holds no version
     */
    public String latestVersion(TrackedPackage trackedPackage) throws IOException {
        PackageRegistry registry = trackedPackage.registry();
        URI uri = registry.metadataUri(trackedPackage.name());
        log.debug("Fetching {}", uri);
        JsonNode version = JSON.readTree(fetcher.fetch(uri)).at(registry.versionPointer());
        if (!version.isTextual() || version.asText().isBlank()) {
            throw new IOException("No version at " + registry.versionPointer() + " in " + uri);
        }
        return version.asText();
    }

    /**
     * Compares the latest release of every package with the recorded versions.
     *
     * @param packages packages to check
     * @return updates, latest versions and lookup failures
     */
    public VersionCheck check(List<TrackedPackage> packages) {
        Map<String, String> recorded = load().versions();
        List<VersionUpdate> updates = new ArrayList<>();
        Map<String, String> latest = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (TrackedPackage trackedPackage : packages) {
            String name = trackedPackage.name();
            String version;
            try {
                version = latestVersion(trackedPackage);
            } catch (IOException e) {
                log.error("Error fetching {} version for {}: {}", trackedPackage.registry(), name, e.getMessage());
                failures.put(name, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                continue;
            }
            latest.put(name, version);
            String current = recorded.get(name);
            if (!version.equals(current)) {
                VersionUpdate update = new VersionUpdate(name, current, version);
                log.info("SDK release detected: {}", update);
                updates.add(update);
            } else {
                log.debug("{} is still at {}", name, version);
            }
        }
        return new VersionCheck(updates, latest, failures);
    }

    /**
     * Records the versions of a check, keeping the previous version of packages that could
     * not be looked up.
     *
     * @param check completed check
     * @throws IOException if the file cannot be written
     */
    public void save(VersionCheck check) throws IOException {
        Map<String, String> versions = new LinkedHashMap<>(load().versions());
        versions.putAll(check.latest());
        VersionFile file = new VersionFile(versions, Instant.now(clock).toString());

        Path directory = versionsFile.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, versionsFile.getFileName().toString(), ".tmp");
        try {
            JSON.writeValue(temp.toFile(), file);
            try {
                Files.move(temp, versionsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, versionsFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Recorded {} SDK versions in {}", versions.size(), versionsFile);
    }
}
