package com.docforge.core.sync;

import com.docforge.core.model.RepoConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalDirectorySyncTest {

    @TempDir
    Path tempDir;

    private final LocalDirectorySync sync = new LocalDirectorySync();

    @Test
    void sync_copiesTreeWithoutGitMetadata() throws Exception {
        Path source = tempDir.resolve("source");
        Files.createDirectories(source.resolve("sdk"));
        Files.createDirectories(source.resolve(".git"));
        Files.writeString(source.resolve("sdk/client.py"), "def greet(name):\n    pass\n");
        Files.writeString(source.resolve(".git/HEAD"), "ref: refs/heads/main\n");
        Path destination = Files.createDirectories(tempDir.resolve("workspace/source"));

        sync.sync(RepoConfig.of(source.toString()), destination);

        assertThat(destination.resolve("sdk/client.py")).hasContent("def greet(name):\n    pass\n");
        assertThat(destination.resolve(".git")).doesNotExist();
    }

    @Test
    void sync_missingSource_throws() {
        assertThatThrownBy(() -> sync.sync(RepoConfig.of(tempDir.resolve("missing").toString()), tempDir.resolve("out")))
            .isInstanceOf(SyncException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void sync_destinationInsideSource_throws() throws Exception {
        Path destination = Files.createDirectories(tempDir.resolve("workspace/copy"));

        assertThatThrownBy(() -> sync.sync(RepoConfig.of(tempDir.toString()), destination))
            .isInstanceOf(SyncException.class)
            .hasMessageContaining("lies inside source");
    }

    @Test
    void supports_localPathsOnly() {
        assertThat(sync.supports(RepoConfig.of("../sdk"))).isTrue();
        assertThat(sync.supports(RepoConfig.of("https://github.com/acme/sdk"))).isFalse();
    }
}
