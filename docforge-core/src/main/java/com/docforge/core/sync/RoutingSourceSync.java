package com.docforge.core.sync;

import com.docforge.core.model.RepoConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Delegates each source to the first implementation that supports it.
 */
public class RoutingSourceSync implements SourceSync {

    private final List<SourceSync> delegates;

    public RoutingSourceSync(List<SourceSync> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    /**
     * Creates the default router: git remotes first, then local directories.
     *
     * @return routing sync
     */
    public static RoutingSourceSync defaults() {
        return new RoutingSourceSync(List.of(new GitSourceSync(), new LocalDirectorySync()));
    }

    @Override
    public boolean supports(RepoConfig repo) {
        return delegates.stream().anyMatch(delegate -> delegate.supports(repo));
    }

    @Override
    public void sync(RepoConfig repo, Path destination) throws SyncException {
        for (SourceSync delegate : delegates) {
            if (delegate.supports(repo)) {
                delegate.sync(repo, destination);
                return;
            }
        }
        throw new SyncException("No source sync supports location: " + repo.location());
    }
}
