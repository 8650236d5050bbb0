package com.docforge.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link ChangeTracker}.
 */
class ChangeTrackerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path cacheFile;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("workspace"));
        cacheFile = tempDir.resolve("cache/build_state.json");
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void computeHash_sameContent_sameDigest() throws IOException {
        Path a = write("a.py", "def f():\n    pass\n");
        Path b = write("b.py", "def f():\n    pass\n");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.computeHash(a))
                .hasSize(64)
                .isEqualTo(tracker.computeHash(b));
        }
    }

    @Test
    void computeHash_contentLargerThanOneChunk_matchesKnownDigest() throws IOException {
        Path big = write("big.txt", "x".repeat(ChangeTracker.CHUNK_SIZE * 3 + 7));
        Path small = write("small.txt", "abc");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.computeHash(big)).isNotEqualTo(tracker.computeHash(small));
            assertThat(tracker.computeHash(small))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }
    }

    @Test
    void computeHash_missingFile_returnsEmptyString() {
        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.computeHash(root.resolve("missing.py"))).isEmpty();
        }
    }

    @Test
    void getChangedUnits_untrackedOrModified_reportsChanged() throws IOException {
        Path tracked = write("tracked.py", "v1");
        Path untouched = write("untouched.py", "v1");
        Path fresh = write("fresh.py", "v1");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(tracked, List.of(), true);
            tracker.updateState(untouched, List.of(), true);
            Files.writeString(tracked, "v2");

            assertThat(tracker.getChangedUnits(List.of(tracked, untouched, fresh)))
                .containsExactly(tracked, fresh);
        }
    }

    @Test
    void invalidate_trackedUnit_isChangedAgainAfterReopen() throws IOException {
        Path client = write("sdk/client.py", "import models");
        Path models = write("sdk/models.py", "class Model: pass");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(client, List.of("sdk/models.py"), true);
            tracker.updateState(models, List.of(), true);

            assertThat(tracker.invalidate(client)).isTrue();
            assertThat(tracker.invalidate(client)).isFalse();
        }

        try (ChangeTracker reopened = ChangeTracker.open(cacheFile, root)) {
            assertThat(reopened.snapshot()).containsOnlyKeys("sdk/models.py");
            assertThat(reopened.getChangedUnits(List.of(client, models))).containsExactly(client);
        }
    }

    @Test
    void updateState_thenReopen_roundTripsState() throws IOException {
        Path client = write("sdk/client.py", "import models");
        write("sdk/models.py", "class Model: pass");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(client, List.of("sdk/models.py"), false);
        }

        try (ChangeTracker reopened = ChangeTracker.open(cacheFile, root)) {
            TrackedUnitState state = reopened.stateOf("sdk/client.py").orElseThrow();
            assertThat(state.dependencies()).containsExactly("sdk/models.py");
            assertThat(state.lastValidationResult()).isFalse();
            assertThat(state.contentHash()).isEqualTo(reopened.computeHash(client));
            assertThat(reopened.getChangedUnits(List.of(client))).isEmpty();
        }
    }

    @Test
    void updateState_overwritesPreviousEntry() throws IOException {
        Path file = write("a.py", "v1");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(file, List.of("b.py"), false);
            Files.writeString(file, "v2");
            tracker.updateState(file, List.of(), true);

            TrackedUnitState state = tracker.stateOf(file).orElseThrow();
            assertThat(state.dependencies()).isEmpty();
            assertThat(state.lastValidationResult()).isTrue();
            assertThat(tracker.size()).isEqualTo(1);
        }
    }

    @Test
    void updateState_missingFile_leavesStateUntouched() throws IOException {
        Path file = write("gone.py", "v1");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(file, List.of(), true);
            Files.delete(file);

            tracker.updateState(file, List.of("other.py"), false);

            TrackedUnitState state = tracker.stateOf(file).orElseThrow();
            assertThat(state.lastValidationResult()).isTrue();
            assertThat(state.dependencies()).isEmpty();
        }
    }

    @Test
    void loadState_corruptCache_startsEmpty() throws IOException {
        Files.createDirectories(cacheFile.getParent());
        Files.writeString(cacheFile, "{ this is not json");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.size()).isZero();

            Path file = write("a.py", "v1");
            assertThat(tracker.getChangedUnits(List.of(file))).containsExactly(file);
        }
    }

    @Test
    void loadState_missingCache_startsEmpty() {
        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.snapshot()).isEmpty();
        }
        assertThat(cacheFile).exists();
    }

    @Test
    void saveState_leavesNoTemporaryFiles() throws IOException {
        Path file = write("a.py", "v1");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(file, List.of(), true);
        }

        try (var files = Files.list(cacheFile.getParent())) {
            assertThat(files.map(path -> path.getFileName().toString()))
                .noneMatch(name -> name.endsWith(".tmp"));
        }
        assertThat(Files.readString(cacheFile)).contains("\"a.py\"");
    }

    @Test
    void getDependents_followsTransitiveChain() throws IOException {
        Path base = write("base.py", "");
        Path middle = write("middle.py", "");
        Path top = write("top.py", "");
        Path unrelated = write("unrelated.py", "");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(base, List.of(), true);
            tracker.updateState(middle, List.of("base.py"), true);
            tracker.updateState(top, List.of("middle.py"), true);
            tracker.updateState(unrelated, List.of(), true);

            assertThat(tracker.getDependents(base)).containsExactly(middle, top);
            assertThat(tracker.getDependents(top)).isEmpty();
        }
    }

    @Test
    void getDependents_cycle_terminatesWithoutSelf() throws IOException {
        Path a = write("a.py", "");
        Path b = write("b.py", "");
        Path c = write("c.py", "");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(a, List.of("c.py"), true);
            tracker.updateState(b, List.of("a.py"), true);
            tracker.updateState(c, List.of("b.py"), true);

            assertThat(tracker.getDependents(a)).containsExactlyInAnyOrder(b, c);
        }
    }

    @Test
    void identifierOf_isRelativeToUnitRoot() throws IOException {
        Path file = write("pkg/mod.py", "");

        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            assertThat(tracker.identifierOf(file)).isEqualTo("pkg/mod.py");
            assertThat(tracker.resolve("pkg/mod.py")).isEqualTo(file.toAbsolutePath().normalize());
        }
    }

    @Test
    void clear_persistsEmptyCache() throws IOException {
        Path file = write("a.py", "v1");
        try (ChangeTracker tracker = ChangeTracker.open(cacheFile, root)) {
            tracker.updateState(file, List.of(), true);
            tracker.clear();
        }

        try (ChangeTracker reopened = ChangeTracker.open(cacheFile, root)) {
            assertThat(reopened.size()).isZero();
        }
    }

    @Test
    void concurrentTrackers_onSameCache_bothSavesComplete() throws Exception {
        Path a = write("a.py", "a");
        Path b = write("b.py", "b");
        ChangeTracker first = ChangeTracker.open(cacheFile, root);
        ChangeTracker second = ChangeTracker.open(cacheFile, root);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> one = pool.submit(() -> {
                start.await();
                first.updateState(a, List.of(), true);
                return null;
            });
            Future<?> two = pool.submit(() -> {
                start.await();
                second.updateState(b, List.of(), true);
                return null;
            });
            start.countDown();
            one.get();
            two.get();
        } finally {
            pool.shutdownNow();
        }

        try (ChangeTracker reopened = ChangeTracker.open(cacheFile, root)) {
            assertThat(reopened.size()).isEqualTo(1);
            assertThat(reopened.snapshot()).containsAnyOf(
                entry("a.py", first.stateOf("a.py").orElseThrow()),
                entry("b.py", second.stateOf("b.py").orElseThrow()));
        }
    }
}
