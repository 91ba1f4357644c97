package com.phillippitts.phiredaction.service.detect;

/**
 * Centralized constants for detector identifiers used in logs, metrics tags and events.
 *
 * @since 1.0
 */
public final class DetectorNames {

    /** Synchronous pattern-based fast lane. */
    public static final String PATTERN = "pattern";

    /** Asynchronous context-model slow lane. */
    public static final String CONTEXTUAL = "contextual";

    private DetectorNames() {
        // Utility class - prevent instantiation
    }
}
