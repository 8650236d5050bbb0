package com.docforge.core.sync;

import com.docforge.core.model.RepoConfig;
import com.docforge.core.util.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Clones git repositories with the {@code git} command line client.
 *
 * <p>Performs a shallow clone ({@code --depth 1}) of the default branch. Credentials
 * embedded in the URL are masked in every log line and error message.
 */
public class GitSourceSync implements SourceSync {

    private static final Logger log = LoggerFactory.getLogger(GitSourceSync.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final String gitExecutable;
    private final Duration timeout;

    public GitSourceSync() {
        this("git", DEFAULT_TIMEOUT);
    }

    public GitSourceSync(String gitExecutable, Duration timeout) {
        this.gitExecutable = Objects.requireNonNull(gitExecutable, "gitExecutable must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Returns true for remote URLs, SSH-style {@code user@host:path} locations and
     * anything ending in {@code .git}.
     */
    @Override
    public boolean supports(RepoConfig repo) {
        return isGitLocation(repo.location());
    }

    public static boolean isGitLocation(String location) {
        String value = location.trim();
        return value.startsWith("https://")
            || value.startsWith("http://")
            || value.startsWith("ssh://")
            || value.startsWith("git://")
            || value.startsWith("git@")
            || value.endsWith(".git");
    }

    @Override
    public void sync(RepoConfig repo, Path destination) throws SyncException {
        String masked = ProcessRunner.mask(repo.location());
        log.info("Cloning {} into {}", masked, destination);

        List<String> command = List.of(gitExecutable, "clone", "--depth", "1", "--quiet",
            repo.location(), destination.toAbsolutePath().toString());
        ProcessRunner.Result result;
        try {
            result = ProcessRunner.run(command, destination.toAbsolutePath().getParent(),
                Map.of("GIT_TERMINAL_PROMPT", "0"), timeout);
        } catch (IOException e) {
            throw new SyncException("Failed to run git for " + masked + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("Interrupted while cloning " + masked, e);
        }

        if (result.timedOut()) {
            throw new SyncException("git clone of " + masked + " timed out after " + timeout.toSeconds() + "s");
        }
        if (!result.succeeded()) {
            throw new SyncException("git clone of " + masked + " failed (exit " + result.exitCode() + "): "
                + ProcessRunner.mask(result.tail(5)));
        }
        log.debug("Cloned {}", masked);
    }
}
