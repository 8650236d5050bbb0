package com.docforge.core.sync;

import com.docforge.core.model.RepoConfig;
import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies a local directory into the workspace.
 *
 * <p>Version-control metadata ({@code .git}) is not copied.
 */
public class LocalDirectorySync implements SourceSync {

    private static final Logger log = LoggerFactory.getLogger(LocalDirectorySync.class);

    @Override
    public boolean supports(RepoConfig repo) {
        return !GitSourceSync.isGitLocation(repo.location());
    }

    @Override
    public void sync(RepoConfig repo, Path destination) throws SyncException {
        Path source = Path.of(repo.location()).toAbsolutePath().normalize();
        if (!Files.isDirectory(source)) {
            throw new SyncException("Source directory does not exist: " + source);
        }
        if (FileUtils.isWithin(source, destination)) {
            throw new SyncException("Workspace " + destination + " lies inside source " + source);
        }

        log.info("Copying {} into {}", source, destination);
        try {
            FileUtils.copyTree(source, destination,
                path -> !path.getFileName().toString().equals(".git"));
        } catch (IOException e) {
            throw new SyncException("Failed to copy " + source + ": " + e.getMessage(), e);
        }
    }
}
