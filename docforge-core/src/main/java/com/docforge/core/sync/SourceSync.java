package com.docforge.core.sync;

import com.docforge.core.model.RepoConfig;

import java.nio.file.Path;

/**
 * Acquires a configured source into a workspace directory.
 *
 * <p>Implementations populate {@code destination} with the source tree. The caller owns
 * the destination: it is created empty before the call and deleted with the workspace.
 *
 * @see GitSourceSync
 * @see LocalDirectorySync
 */
public interface SourceSync {

    /**
     * Returns true if this implementation can acquire the given source.
     *
     * @param repo configured source
     * @return true if supported
     */
    boolean supports(RepoConfig repo);

    /**
     * Copies or clones the source into the destination directory.
     *
     * @param repo configured source
     * @param destination empty workspace directory
     * @throws SyncException if the source cannot be acquired
     */
    void sync(RepoConfig repo, Path destination) throws SyncException;
}
