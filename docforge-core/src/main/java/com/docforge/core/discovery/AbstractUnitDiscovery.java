package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;
import com.docforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Base class for single-language discoveries.
 *
 * <p>Provides the shared file walk: restriction handling, exclusion of non-API
 * directories, and per-file error isolation. Subclasses only parse one file at a time.
 */
public abstract class AbstractUnitDiscovery implements UnitDiscovery {

    /**
     * Directory names never descended into.
     */
    static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
        "test", "tests", "docs", "_build", "site", "node_modules", "__pycache__", "build", "target", "venv"
    );

    protected final Logger log;

    protected AbstractUnitDiscovery() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Returns the file extension handled, without the dot.
     *
     * @return extension such as {@code py}
     */
    protected abstract String extension();

    /**
     * Parses the units of one file.
     *
     * @param file source file
     * @param base directory module names are relative to
     * @return units declared in the file
     * @throws IOException if the file cannot be read
     */
    protected abstract List<DocumentableUnit> parseFile(Path file, Path base) throws IOException;

    @Override
    public boolean supports(Path file) {
        return extension().equalsIgnoreCase(FileUtils.getExtension(file));
    }

    @Override
    public List<DocumentableUnit> discover(Path root, List<Path> restrictTo) throws DiscoveryException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new DiscoveryException("Source root is not a directory: " + root);
        }

        List<DocumentableUnit> units = new ArrayList<>();
        for (Path base : searchBases(normalizedRoot, restrictTo)) {
            for (Path file : sourceFiles(normalizedRoot, base)) {
                try {
                    units.addAll(parseFile(file, Files.isDirectory(base) ? base : base.getParent()));
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to parse {}: {}", file, e.getMessage());
                }
            }
        }
        log.debug("{} discovery found {} units under {}", getId(), units.size(), normalizedRoot);
        return units;
    }

    private List<Path> searchBases(Path root, List<Path> restrictTo) {
        if (restrictTo == null || restrictTo.isEmpty()) {
            return List.of(root);
        }
        Set<Path> bases = new LinkedHashSet<>();
        for (Path restriction : restrictTo) {
            Path base = root.resolve(restriction).normalize();
            if (!FileUtils.isWithin(root, base)) {
                log.error("'{}' is not in the subpath of '{}'", restriction, root);
                continue;
            }
            if (!Files.exists(base)) {
                log.warn("Restricted path does not exist: {}", base);
                continue;
            }
            bases.add(base);
        }
        return List.copyOf(bases);
    }

    /**
     * Lists the supported files below a base directory, skipping excluded directories.
     *
     * @param root source root
     * @param base directory (or single file) to search
     * @return sorted source files
     * @throws DiscoveryException if the walk fails
     */
    protected List<Path> sourceFiles(Path root, Path base) throws DiscoveryException {
        if (Files.isRegularFile(base)) {
            return supports(base) ? List.of(base) : List.of();
        }
        try (Stream<Path> paths = Files.walk(base)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(this::supports)
                .filter(path -> !isExcluded(root, path))
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new DiscoveryException("Failed to walk " + base + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns true if any directory between the root and the file is excluded.
     *
     * @param root source root
     * @param file candidate file
     * @return true if the file must be skipped
     */
    static boolean isExcluded(Path root, Path file) {
        if (!FileUtils.isWithin(root, file)) {
            return true;
        }
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            String name = relative.getName(i).toString();
            if (EXCLUDED_DIRECTORIES.contains(name) || name.startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keeps only existing files inside the root, other than the file itself.
     *
     * @param file the depending file
     * @param root source root
     * @param candidates resolved candidates
     * @return de-duplicated dependency files
     */
    protected static List<Path> existingDependencies(Path file, Path root, Set<Path> candidates) {
        Path self = file.toAbsolutePath().normalize();
        List<Path> dependencies = new ArrayList<>();
        for (Path candidate : candidates) {
            Path normalized = candidate.toAbsolutePath().normalize();
            if (!normalized.equals(self)
                && FileUtils.isWithin(root, normalized)
                && Files.isRegularFile(normalized)
                && !dependencies.contains(normalized)) {
                dependencies.add(normalized);
            }
        }
        return dependencies;
    }
}
