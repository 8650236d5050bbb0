package com.docforge.core.cache;

import com.docforge.core.util.FileUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Content-hash cache that decides which tracked units must be reprocessed.
 *
 * <p>Maps a unit identifier to its last content hash, declared dependencies and last
 * validation outcome, and persists that map as a JSON document. The tracker is the sole
 * writer of its cache file.
 *
 * <h2>Identifiers</h2>
 * <p>A unit is identified by its path relative to the tracker's unit root, using
 * {@code /} separators. Units outside the root fall back to their absolute path. Relative
 * identifiers keep the cache valid when the transient workspace is recreated.
 *
 * <h2>Durability</h2>
 * <ul>
 *   <li>Every {@link #updateState} rewrites the whole file (write-through), so a crash
 *       between updates loses at most the unit in flight.</li>
 *   <li>Saves write a temporary sibling and move it over the cache file, so a failed
 *       write never corrupts the previously persisted snapshot.</li>
 *   <li>A corrupt or unreadable cache degrades to an empty state: it forces full
 *       recomputation but never blocks a build.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>Units may be processed concurrently; the in-memory map is guarded by a read/write
 * lock (single writer, concurrent readers). Saves additionally hold an advisory lock on
 * {@code <cache file>.lock} so separate build processes serialize around the file
 * replacement. The last save wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (ChangeTracker tracker = ChangeTracker.open(Path.of(".cache/build_state.json"), workspaceRoot)) {
 *     List<Path> changed = tracker.getChangedUnits(candidates);
 *     // ... process changed units ...
 *     tracker.updateState(file, List.of("sdk/util.py"), true);
 * }
 * }</pre>
 */
public final class ChangeTracker implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ChangeTracker.class);

    /**
     * Size of the chunks content is read in while hashing.
     */
    static final int CHUNK_SIZE = 4096;

    private static final String HASH_ALGORITHM = "SHA-256";

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<LinkedHashMap<String, TrackedUnitState>> STATE_TYPE = new TypeReference<>() {};

    /**
     * In-JVM monitors per cache file; {@link FileLock} only arbitrates between processes.
     */
    private static final Map<Path, Object> SAVE_MONITORS = new ConcurrentHashMap<>();

    private final Path cacheFile;
    private final Path unitRoot;
    private final Map<String, TrackedUnitState> state = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    private ChangeTracker(Path cacheFile, Path unitRoot) {
        this.cacheFile = cacheFile.toAbsolutePath().normalize();
        this.unitRoot = unitRoot.toAbsolutePath().normalize();
    }

    /**
     * Opens a tracker over a cache file, loading any previously persisted state.
     *
     * @param cacheFile JSON cache location; need not exist yet
     * @param unitRoot directory unit identifiers are relative to
     * @return an open tracker
     */
    public static ChangeTracker open(Path cacheFile, Path unitRoot) {
        ChangeTracker tracker = new ChangeTracker(cacheFile, unitRoot);
        tracker.loadState();
        return tracker;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public Path unitRoot() {
        return unitRoot;
    }

    // ==================== Persistence ====================

    /**
     * Replaces the in-memory state with the persisted cache.
     *
     * <p>A missing file yields an empty state. Any parse or read failure is logged and
     * also yields an empty state. Never throws.
     */
    public void loadState() {
        lock.writeLock().lock();
        try {
            state.clear();
            if (!Files.exists(cacheFile)) {
                log.debug("No cache file found at {}", cacheFile);
                return;
            }
            Map<String, TrackedUnitState> loaded = JSON.readValue(cacheFile.toFile(), STATE_TYPE);
            if (loaded == null) {
                log.warn("Cache file {} holds no state; starting from an empty cache", cacheFile);
                return;
            }
            loaded.forEach((key, value) -> {
                if (key != null && value != null) {
                    state.put(key, value);
                }
            });
            log.debug("Loaded {} cached entries from {}", state.size(), cacheFile);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load cache file {}, starting from an empty cache: {}", cacheFile, e.getMessage());
            state.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Serializes the whole in-memory map and replaces the cache file with it.
     *
     * <p>Failures are logged and swallowed: caching is an optimization, not a
     * build-blocking concern.
     */
    public void saveState() {
        lock.writeLock().lock();
        try {
            writeSnapshot(new TreeMap<>(state));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save cache file {}: {}", cacheFile, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void writeSnapshot(Map<String, TrackedUnitState> snapshot) throws IOException {
        Path directory = cacheFile.getParent();
        Files.createDirectories(directory);
        byte[] content = JSON.writeValueAsBytes(snapshot);

        Object monitor = SAVE_MONITORS.computeIfAbsent(cacheFile, key -> new Object());
        synchronized (monitor) {
            Path lockFile = directory.resolve(cacheFile.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                Path temp = Files.createTempFile(directory, cacheFile.getFileName().toString(), ".tmp");
                try {
                    Files.write(temp, content);
                    moveIntoPlace(temp);
                } finally {
                    Files.deleteIfExists(temp);
                }
            }
        }
        log.debug("Saved {} cache entries to {}", snapshot.size(), cacheFile);
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Persists the current state. Alias of {@link #saveState()} for lifecycle symmetry.
     */
    public void flush() {
        saveState();
    }

    /**
     * Flushes the state once; later calls are no-ops.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            flush();
        }
    }

    // ==================== Change Detection ====================

    /**
     * Computes the SHA-256 digest of a unit's content, reading it in {@value #CHUNK_SIZE}-byte chunks.
     *
     * @param unit file to hash
     * @return lowercase hex digest, or an empty string if the file does not exist or cannot be read
     */
    public String computeHash(Path unit) {
        if (!Files.isRegularFile(unit)) {
            return "";
        }
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(unit)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} for hashing: {}", unit, e.getMessage());
            return "";
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }

    /**
     * Returns the candidates that changed since they were last recorded.
     *
     * <p>A unit is changed when no entry exists for it or its current hash differs from
     * the stored one.
     *
     * @param candidates units to check
     * @return changed subset, in input order
     */
    public List<Path> getChangedUnits(List<Path> candidates) {
        List<Path> changed = new ArrayList<>();
        for (Path candidate : candidates) {
            String identifier = identifierOf(candidate);
            Optional<TrackedUnitState> previous = stateOf(identifier);
            if (previous.isEmpty()) {
                log.debug("{}: new unit", identifier);
                changed.add(candidate);
                continue;
            }
            String currentHash = computeHash(candidate);
            if (!currentHash.equals(previous.get().contentHash())) {
                log.debug("{}: content changed ({} -> {})", identifier, previous.get().contentHash(), currentHash);
                changed.add(candidate);
            }
        }
        log.debug("{} of {} units changed", changed.size(), candidates.size());
        return changed;
    }

    /**
     * Records the outcome of processing a unit and persists the full cache.
     *
     * <p>A unit that no longer exists is skipped with a warning; existing entries are
     * left untouched.
     *
     * @param unit processed unit
     * @param dependencies identifiers of the units it depends on
     * @param validationResult final validation verdict
     */
    public void updateState(Path unit, Collection<String> dependencies, boolean validationResult) {
        if (!Files.exists(unit)) {
            log.warn("Skipping cache update for missing unit: {}", unit);
            return;
        }
        String hash = computeHash(unit);
        String identifier = identifierOf(unit);
        lock.writeLock().lock();
        try {
            state.put(identifier, new TrackedUnitState(hash, List.copyOf(dependencies), validationResult));
            saveState();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forgets a unit so the next build treats it as changed. Persists only if an entry
     * was removed.
     *
     * @param unit unit to forget
     * @return whether an entry existed
     */
    public boolean invalidate(Path unit) {
        String identifier = identifierOf(unit);
        lock.writeLock().lock();
        try {
            if (state.remove(identifier) == null) {
                return false;
            }
            log.debug("Invalidated cache entry for {}", identifier);
            saveState();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns every unit that depends on the given unit, directly or transitively.
     *
     * <p>Walks the reverse dependency graph breadth-first with a visited set, so cycles
     * terminate. The unit itself is never part of the result.
     *
     * @param unit unit whose dependents are wanted
     * @return dependents in breadth-first order
     */
    public Set<Path> getDependents(Path unit) {
        String target = identifierOf(unit);
        Map<String, List<String>> reverse = new HashMap<>();
        for (Map.Entry<String, TrackedUnitState> entry : snapshot().entrySet()) {
            for (String dependency : entry.getValue().dependencies()) {
                reverse.computeIfAbsent(dependency, key -> new ArrayList<>()).add(entry.getKey());
            }
        }

        Set<String> visited = new HashSet<>();
        visited.add(target);
        Set<Path> dependents = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(target);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : reverse.getOrDefault(current, List.of())) {
                if (visited.add(dependent)) {
                    dependents.add(resolve(dependent));
                    queue.add(dependent);
                }
            }
        }
        return dependents;
    }

    // ==================== State Access ====================

    public Optional<TrackedUnitState> stateOf(Path unit) {
        return stateOf(identifierOf(unit));
    }

    public Optional<TrackedUnitState> stateOf(String identifier) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(state.get(identifier));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns an immutable copy of the current state.
     *
     * @return identifier to state
     */
    public Map<String, TrackedUnitState> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(state);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return state.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every entry and persists the empty cache.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            state.clear();
            saveState();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the stable identifier of a unit.
     *
     * @param unit unit path
     * @return identifier relative to the unit root
     */
    public String identifierOf(Path unit) {
        return FileUtils.toIdentifier(unitRoot, unit);
    }

    /**
     * Resolves an identifier back to a path under the unit root.
     *
     * @param identifier unit identifier
     * @return path of the unit
     */
    public Path resolve(String identifier) {
        Path path = Path.of(identifier);
        return path.isAbsolute() ? path : unitRoot.resolve(identifier).normalize();
    }
}
