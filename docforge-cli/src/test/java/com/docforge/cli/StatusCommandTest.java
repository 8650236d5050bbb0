package com.docforge.cli;

import com.docforge.core.cache.ChangeTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusCommandTest {

    @TempDir
    Path tempDir;

    private Path config;

    @BeforeEach
    void setUp() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("source"));
        Files.writeString(source.resolve("client.py"), """
            def greet(name):
                \"\"\"Greet someone.\"\"\"
                return "Hello, " + name
            """);
        config = Files.writeString(tempDir.resolve("docforge.yaml"), """
            repositories:
              - name: sdk
                location: source
            workspace:
              directory: ws
            cache:
              file: .cache/build_state.json
            """);
    }

    @Test
    void status_freshCache_listsFileAsChanged() {
        CommandTestSupport.Run run = CommandTestSupport.run("status", "-c", config.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("✓ sdk")
            .contains("changed    sdk/client.py")
            .contains("1 of 1 files would be reprocessed");
        assertThat(tempDir.resolve("ws/sdk")).doesNotExist();
    }

    @Test
    void status_cachedFile_isUpToDate() throws Exception {
        Path workspaceFile = tempDir.resolve("ws/sdk/client.py");
        Files.createDirectories(workspaceFile.getParent());
        Files.copy(tempDir.resolve("source/client.py"), workspaceFile);
        try (ChangeTracker tracker = ChangeTracker.open(tempDir.resolve(".cache/build_state.json"), tempDir.resolve("ws"))) {
            tracker.updateState(workspaceFile, List.of(), true);
        }

        CommandTestSupport.Run run = CommandTestSupport.run("status", "-c", config.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("unchanged  sdk/client.py")
            .contains("✓ Up to date (1 files)");
    }

    @Test
    void status_missingSource_reportsFailedSync() throws Exception {
        Files.writeString(config, """
            repositories:
              - name: gone
                location: does-not-exist
            workspace:
              directory: ws
            """);

        CommandTestSupport.Run run = CommandTestSupport.run("status", "-c", config.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✗ gone: Source directory does not exist");
    }
}
