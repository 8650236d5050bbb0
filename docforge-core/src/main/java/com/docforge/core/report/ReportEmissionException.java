package com.docforge.core.report;

/**
 * Thrown when build reports cannot be written.
 *
 * <p>Unlike per-unit failures this propagates out of the build: a build whose reports
 * are missing must not look successful.
 */
public class ReportEmissionException extends RuntimeException {

    public ReportEmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
