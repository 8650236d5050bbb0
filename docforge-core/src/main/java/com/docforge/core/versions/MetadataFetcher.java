package com.docforge.core.versions;

import java.io.IOException;
import java.net.URI;

/**
 * Fetches a registry metadata document.
 */
@FunctionalInterface
public interface MetadataFetcher {

    /**
     * Fetches the document at {@code uri}.
     *
     * @param uri metadata location
     * @return response body
     * @throws IOException if the document cannot be retrieved or the registry answers with an error
     */
    String fetch(URI uri) throws IOException;
}
