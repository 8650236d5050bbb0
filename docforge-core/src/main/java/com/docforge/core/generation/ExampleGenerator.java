package com.docforge.core.generation;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.model.GeneratedArtifact;

import java.util.List;

/**
 * Produces usage examples, with optional tests, for a documentable unit.
 *
 * <p>Implementations report their own failures by returning an empty list. Anything
 * they throw is caught at the orchestrator's unit boundary and recorded against the unit.
 */
@FunctionalInterface
public interface ExampleGenerator {

    /**
     * Generates examples for a unit.
     *
     * @param unit unit to document
     * @return generated artifacts, possibly empty
     */
    List<GeneratedArtifact> generate(DocumentableUnit unit);
}
