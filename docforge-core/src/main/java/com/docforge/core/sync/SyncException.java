package com.docforge.core.sync;

/**
 * Thrown when a source cannot be acquired into the workspace.
 *
 * <p>Fatal for the affected source only; the build continues with the remaining sources.
 */
public class SyncException extends Exception {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
