package com.docforge.cli;

import com.docforge.core.versions.MetadataFetcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CheckVersionsCommandTest {

    private static final URI PYPI_ANTHROPIC = URI.create("https://pypi.org/pypi/anthropic/json");
    private static final URI NPM_SDK = URI.create("https://registry.npmjs.org/@anthropic-ai/sdk");

    @TempDir
    Path tempDir;

    private final List<URI> requested = new ArrayList<>();

    private MetadataFetcher serving(Map<URI, String> documents) {
        return uri -> {
            requested.add(uri);
            String document = documents.get(uri);
            if (document == null) {
                throw new IOException("GET " + uri + " returned HTTP 404");
            }
            return document;
        };
    }

    private CommandTestSupport.Run checkVersions(MetadataFetcher fetcher, String... args) {
        return CommandTestSupport.run(new CommandLine(new CheckVersionsCommand(fetcher)), args);
    }

    @Test
    void checkVersions_firstRun_reportsReleasesAndRecordsThem() {
        Path versions = tempDir.resolve("sdk_versions.json");
        MetadataFetcher fetcher = serving(Map.of(
            PYPI_ANTHROPIC, "{\"info\": {\"version\": \"0.25.1\"}}",
            NPM_SDK, "{\"dist-tags\": {\"latest\": \"0.20.0\"}}"));

        CommandTestSupport.Run run = checkVersions(fetcher, "--versions-file", versions.toString());

        assertThat(run.exitCode()).isEqualTo(CheckVersionsCommand.EXIT_UPDATES);
        assertThat(run.out()).contains("anthropic: (untracked) -> 0.25.1", "@anthropic-ai/sdk: (untracked) -> 0.20.0");
        assertThat(requested).containsExactly(PYPI_ANTHROPIC, NPM_SDK);
        assertThat(versions).content().contains("\"anthropic\" : \"0.25.1\"", "last_checked");
    }

    @Test
    void checkVersions_secondRunUnchanged_exitsZero() {
        Path versions = tempDir.resolve("sdk_versions.json");
        MetadataFetcher fetcher = serving(Map.of(PYPI_ANTHROPIC, "{\"info\": {\"version\": \"0.25.1\"}}"));
        checkVersions(fetcher, "--versions-file", versions.toString(), "--pypi", "anthropic");

        CommandTestSupport.Run run = checkVersions(fetcher, "--versions-file", versions.toString(), "--pypi", "anthropic");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("No new SDK releases (1 packages checked)");
    }

    @Test
    void checkVersions_dryRun_leavesVersionsFileAlone() {
        Path versions = tempDir.resolve("sdk_versions.json");
        MetadataFetcher fetcher = serving(Map.of(PYPI_ANTHROPIC, "{\"info\": {\"version\": \"0.25.1\"}}"));

        CommandTestSupport.Run run = checkVersions(fetcher,
            "--versions-file", versions.toString(), "--pypi", "anthropic", "--dry-run");

        assertThat(run.exitCode()).isEqualTo(CheckVersionsCommand.EXIT_UPDATES);
        assertThat(versions).doesNotExist();
    }

    @Test
    void checkVersions_everyLookupFails_exitsWithError() {
        Path versions = tempDir.resolve("sdk_versions.json");

        CommandTestSupport.Run run = checkVersions(serving(Map.of()),
            "--versions-file", versions.toString(), "--npm", "@anthropic-ai/sdk");

        assertThat(run.exitCode()).isEqualTo(BuildCommand.EXIT_ERROR);
        assertThat(run.err()).contains("@anthropic-ai/sdk", "HTTP 404", "No package could be looked up");
        assertThat(versions).doesNotExist();
    }

    @Test
    void checkVersions_releaseWithBuild_runsTheBuild() throws IOException {
        Path versions = tempDir.resolve("sdk_versions.json");
        Path config = Files.writeString(tempDir.resolve("docforge.yaml"), """
            repositories: []
            """);
        MetadataFetcher fetcher = serving(Map.of(PYPI_ANTHROPIC, "{\"info\": {\"version\": \"0.25.1\"}}"));

        CommandTestSupport.Run run = checkVersions(fetcher, "--versions-file", versions.toString(),
            "--pypi", "anthropic", "--build", "-c", config.toString(), "--api-key", "test-key");

        assertThat(run.out()).contains("Triggering documentation build");
        assertThat(run.exitCode()).isEqualTo(BuildCommand.EXIT_ERROR);
        assertThat(run.err()).contains("No repositories configured");
        assertThat(versions).exists();
    }
}
