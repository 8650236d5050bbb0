package com.docforge.core.validation;

import com.docforge.core.model.ValidationVerdict;

/**
 * Checks documentation for accuracy against its source.
 *
 * <p>An invalid verdict means the documentation was judged and found wrong, and the build
 * caches it as such. Implementations throw when no judgement could be made (service errors,
 * unreachable model); the orchestrator reports that for the current build only and retries
 * the file on the next one.
 */
@FunctionalInterface
public interface DocValidator {

    /**
     * Validates documentation against source.
     *
     * @param request source and documentation
     * @return verdict
     */
    ValidationVerdict validate(ValidationRequest request);
}
