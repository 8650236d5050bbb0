package com.docforge.core.discovery;

/**
 * Thrown when the source tree cannot be walked.
 *
 * <p>Aborts the build: without a unit list there is nothing to process.
 */
public class DiscoveryException extends Exception {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
