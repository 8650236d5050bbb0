package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Service Provider Interface for discovering documentable units in a source tree.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Each
 * implementation handles one source language and must be registered in
 * {@code META-INF/services/com.docforge.core.discovery.UnitDiscovery}.
 *
 * <p><b>Implementation Guidelines:</b>
 * <ul>
 *   <li>Skip test, documentation, build output and hidden directories</li>
 *   <li>Skip private elements (they are not part of the documented surface)</li>
 *   <li>Never return units located outside the discovery root</li>
 *   <li>Log and skip individual files that cannot be parsed; throw only when the tree
 *       itself cannot be walked</li>
 * </ul>
 *
 * @see CompositeUnitDiscovery
 */
public interface UnitDiscovery {

    /**
     * Returns the unique identifier of this discovery, e.g. {@code "python"}.
     *
     * @return discovery ID
     */
    String getId();

    /**
     * Returns true if this discovery parses the given file.
     *
     * @param file candidate source file
     * @return true if supported
     */
    boolean supports(Path file);

    /**
     * Discovers documentable units.
     *
     * @param root source root
     * @param restrictTo paths below the root to limit discovery to; empty for the whole tree
     * @return units in deterministic (file, then declaration) order
     * @throws DiscoveryException if the tree cannot be walked
     */
    List<DocumentableUnit> discover(Path root, List<Path> restrictTo) throws DiscoveryException;

    /**
     * Returns the files within {@code root} that the given file depends on.
     *
     * @param file source file
     * @param root source root
     * @return dependency files, never including {@code file} itself
     */
    default List<Path> dependenciesOf(Path file, Path root) {
        return List.of();
    }
}
