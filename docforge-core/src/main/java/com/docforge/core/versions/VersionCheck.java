package com.docforge.core.versions;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one pass over the tracked packages.
 *
 * @param updates packages whose latest release differs from the recorded version
 * @param latest latest version of every package that could be looked up
 * @param failures packages that could not be looked up, with the reason
 */
public record VersionCheck(List<VersionUpdate> updates, Map<String, String> latest, Map<String, String> failures) {

    public VersionCheck {
        updates = List.copyOf(updates);
        latest = Map.copyOf(latest);
        failures = Map.copyOf(failures);
    }

    public boolean hasUpdates() {
        return !updates.isEmpty();
    }
}
