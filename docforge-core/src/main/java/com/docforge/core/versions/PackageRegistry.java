package com.docforge.core.versions;

import java.net.URI;

/**
 * Package registries an SDK release can be looked up in.
 */
public enum PackageRegistry {

    PYPI("https://pypi.org/pypi/%s/json", "/info/version"),
    NPM("https://registry.npmjs.org/%s", "/dist-tags/latest");

    private final String metadataUrl;
    private final String versionPointer;

    PackageRegistry(String metadataUrl, String versionPointer) {
        this.metadataUrl = metadataUrl;
        this.versionPointer = versionPointer;
    }

    /**
     * Returns the URI of the package's metadata document.
     *
     * @param packageName registry name, scoped npm names included
     * @return metadata URI
     */
    public URI metadataUri(String packageName) {
        return URI.create(metadataUrl.formatted(packageName));
    }

    /**
     * JSON pointer to the latest released version inside the metadata document.
     */
    public String versionPointer() {
        return versionPointer;
    }
}
