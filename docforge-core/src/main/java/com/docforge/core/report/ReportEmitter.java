package com.docforge.core.report;

/**
 * Writes the reports of a build to permanent storage.
 */
@FunctionalInterface
public interface ReportEmitter {

    /**
     * Emits all reports for a build.
     *
     * @param report build report data
     * @throws ReportEmissionException if a report cannot be written
     */
    void emit(BuildReport report);
}
