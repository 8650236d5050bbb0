package com.docforge.core.testing;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;
import com.docforge.core.model.TestOutcome;

import java.nio.file.Path;

/**
 * Executes generated test code.
 *
 * <p>Implementations report failures, including timeouts, as a failed
 * {@link TestOutcome}. Anything they throw is caught at the orchestrator's unit boundary.
 */
public interface TestExecutor {

    /**
     * Returns true if tests for the given unit can be executed.
     *
     * @param unit documented unit
     * @return true if supported
     */
    default boolean supports(DocumentableUnit unit) {
        return true;
    }

    /**
     * Runs the test code of an artifact.
     *
     * @param artifact artifact carrying test code
     * @param unit unit the artifact documents
     * @param workDir directory the unit's module is importable from
     * @return outcome of the run
     */
    TestOutcome execute(GeneratedArtifact artifact, DocumentableUnit unit, Path workDir);
}
