package com.docforge.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getExtension_withExtension_returnsExtension() {
        assertThat(FileUtils.getExtension(Path.of("client.py"))).isEqualTo("py");
        assertThat(FileUtils.getExtension(Path.of("archive.tar.gz"))).isEqualTo("gz");
    }

    @Test
    void getExtension_withoutExtensionOrDotfile_returnsEmpty() {
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".gitignore"))).isEmpty();
    }

    @Test
    void isWithin_detectsEscapes() {
        Path root = tempDir.resolve("root");

        assertThat(FileUtils.isWithin(root, root.resolve("a/b.py"))).isTrue();
        assertThat(FileUtils.isWithin(root, root)).isTrue();
        assertThat(FileUtils.isWithin(root, root.resolve("../other/b.py"))).isFalse();
        assertThat(FileUtils.isWithin(root, tempDir.resolve("root-sibling"))).isFalse();
    }

    @Test
    void toIdentifier_insideRoot_isRelativeWithForwardSlashes() {
        Path root = tempDir.resolve("ws");

        assertThat(FileUtils.toIdentifier(root, root.resolve("sdk").resolve("client.py"))).isEqualTo("sdk/client.py");
    }

    @Test
    void toIdentifier_outsideRoot_keepsAbsolutePath() {
        Path outside = tempDir.resolve("elsewhere/file.py");

        assertThat(FileUtils.toIdentifier(tempDir.resolve("ws"), outside))
            .isEqualTo(outside.toAbsolutePath().normalize().toString().replace('\\', '/'));
    }

    @Test
    void copyTree_skipsRejectedEntries() throws IOException {
        Path source = Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(source.resolve(".git"));
        Files.writeString(source.resolve(".git/HEAD"), "ref");
        Files.createDirectories(source.resolve("pkg"));
        Files.writeString(source.resolve("pkg/mod.py"), "x = 1");
        Path target = tempDir.resolve("copy");

        FileUtils.copyTree(source, target, path -> !path.getFileName().toString().equals(".git"));

        assertThat(target.resolve("pkg/mod.py")).hasContent("x = 1");
        assertThat(target.resolve(".git")).doesNotExist();
    }

    @Test
    void deleteTree_keepsProtectedPathsAndTheirParents() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("ws"));
        Files.createDirectories(root.resolve("src/pkg"));
        Files.writeString(root.resolve("src/pkg/mod.py"), "x");
        Path reports = Files.createDirectories(root.resolve("out/reports"));
        Files.writeString(reports.resolve("test_report.md"), "# Report");

        FileUtils.deleteTree(root, path -> path.startsWith(reports));

        assertThat(root.resolve("src")).doesNotExist();
        assertThat(reports.resolve("test_report.md")).exists();
    }

    @Test
    void deleteTree_missingRoot_isNoOp() throws IOException {
        FileUtils.deleteTree(tempDir.resolve("missing"), path -> false);

        assertThat(tempDir.resolve("missing")).doesNotExist();
    }
}
