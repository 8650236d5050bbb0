package com.docforge.core.pipeline;

import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transient directory that sources are synced into for one build.
 *
 * <p>Each source gets its own subdirectory, recreated from scratch whenever it is
 * prepared. {@link #cleanup()} deletes the whole tree but never touches protected paths
 * (the cache file and the permanent docs and reports directories), even when they were
 * configured to live inside the workspace.
 */
public final class BuildWorkspace {

    private static final Logger log = LoggerFactory.getLogger(BuildWorkspace.class);

    private final Path root;
    private final List<Path> protectedPaths = new ArrayList<>();
    private final AtomicBoolean cleaned = new AtomicBoolean();

    private BuildWorkspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Creates a workspace in a fresh temporary directory.
     *
     * @return workspace
     * @throws IOException if the directory cannot be created
     */
    public static BuildWorkspace temporary() throws IOException {
        return new BuildWorkspace(Files.createTempDirectory("docforge-"));
    }

    /**
     * Creates a workspace at a fixed location.
     *
     * @param directory workspace directory, created if missing
     * @return workspace
     * @throws IOException if the directory cannot be created
     */
    public static BuildWorkspace at(Path directory) throws IOException {
        Files.createDirectories(directory);
        return new BuildWorkspace(directory);
    }

    public Path root() {
        return root;
    }

    /**
     * Registers paths that {@link #cleanup()} must leave in place.
     *
     * @param paths protected files or directories
     * @return this workspace
     */
    public BuildWorkspace protect(Path... paths) {
        for (Path path : paths) {
            protectedPaths.add(path.toAbsolutePath().normalize());
        }
        return this;
    }

    /**
     * Deletes and recreates the directory of one source.
     *
     * @param slug directory name of the source
     * @return empty source directory
     * @throws IOException if the directory cannot be prepared
     */
    public Path prepareSourceDirectory(String slug) throws IOException {
        Path directory = root.resolve(slug).normalize();
        if (!directory.getParent().equals(root)) {
            throw new IOException("Invalid source directory name: " + slug);
        }
        FileUtils.deleteTree(directory, this::isProtected);
        Files.createDirectories(directory);
        cleaned.set(false);
        return directory;
    }

    /**
     * Returns true if a path is, or lies inside, a protected path.
     *
     * @param path candidate path
     * @return true if the path must not be deleted
     */
    public boolean isProtected(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return protectedPaths.stream().anyMatch(normalized::startsWith);
    }

    /**
     * Removes the workspace tree. Safe to call any number of times.
     */
    public void cleanup() {
        if (!cleaned.compareAndSet(false, true)) {
            return;
        }
        try {
            FileUtils.deleteTree(root, this::isProtected);
            if (Files.exists(root)) {
                log.warn("Workspace {} kept because it contains protected paths", root);
            } else {
                log.debug("Removed workspace {}", root);
            }
        } catch (IOException e) {
            cleaned.set(false);
            log.error("Failed to clean up workspace {}: {}", root, e.getMessage());
        }
    }
}
