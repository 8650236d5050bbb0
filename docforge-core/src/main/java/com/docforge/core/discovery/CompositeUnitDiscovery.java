package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Runs several discoveries over the same tree and concatenates their units.
 *
 * <p>Delegates run in ID order so that the combined unit list is deterministic.
 */
public class CompositeUnitDiscovery implements UnitDiscovery {

    private static final Logger log = LoggerFactory.getLogger(CompositeUnitDiscovery.class);

    private final List<UnitDiscovery> delegates;

    public CompositeUnitDiscovery(List<UnitDiscovery> delegates) {
        List<UnitDiscovery> sorted = new ArrayList<>(delegates);
        sorted.sort(Comparator.comparing(UnitDiscovery::getId));
        this.delegates = List.copyOf(sorted);
    }

    /**
     * Creates a composite over every discovery registered with {@link ServiceLoader}.
     *
     * @return composite discovery
     */
    public static CompositeUnitDiscovery loadInstalled() {
        log.debug("Discovering unit discoveries via ServiceLoader");
        List<UnitDiscovery> found = new ArrayList<>();
        for (UnitDiscovery discovery : ServiceLoader.load(UnitDiscovery.class)) {
            log.debug("Found unit discovery: {}", discovery.getId());
            found.add(discovery);
        }
        return new CompositeUnitDiscovery(found);
    }

    public List<UnitDiscovery> delegates() {
        return delegates;
    }

    @Override
    public String getId() {
        return "composite";
    }

    @Override
    public boolean supports(Path file) {
        return delegates.stream().anyMatch(delegate -> delegate.supports(file));
    }

    @Override
    public List<DocumentableUnit> discover(Path root, List<Path> restrictTo) throws DiscoveryException {
        List<DocumentableUnit> units = new ArrayList<>();
        for (UnitDiscovery delegate : delegates) {
            units.addAll(delegate.discover(root, restrictTo));
        }
        return units;
    }

    @Override
    public List<Path> dependenciesOf(Path file, Path root) {
        for (UnitDiscovery delegate : delegates) {
            if (delegate.supports(file)) {
                return delegate.dependenciesOf(file, root);
            }
        }
        return List.of();
    }
}
