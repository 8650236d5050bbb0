package com.docforge.core.pipeline;

import org.slf4j.MDC;

/**
 * Puts the identifier of the file being processed into the logging MDC.
 *
 * <pre>{@code
 * try (UnitMdc ignored = UnitMdc.enter("sdk/client.py")) {
 *     log.info("Validating");   // logged with unit=sdk/client.py
 * }
 * }</pre>
 */
public final class UnitMdc implements AutoCloseable {

    /**
     * MDC key carrying the unit identifier.
     */
    public static final String KEY = "unit";

    private final String previous;

    private UnitMdc(String identifier) {
        this.previous = MDC.get(KEY);
        MDC.put(KEY, identifier);
    }

    public static UnitMdc enter(String identifier) {
        return new UnitMdc(identifier);
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(KEY);
        } else {
            MDC.put(KEY, previous);
        }
    }
}
