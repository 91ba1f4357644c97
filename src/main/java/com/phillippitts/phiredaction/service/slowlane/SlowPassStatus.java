package com.phillippitts.phiredaction.service.slowlane;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Result of requesting a slow-lane pass.
 */
public enum SlowPassStatus {

    /** A pass was started for the request. */
    ACCEPTED,

    /**
     * Deferred: a pass is already running, or the slow-lane pool is saturated. One follow-up
     * pass will run later.
     */
    COALESCED,

    /** The slow lane is disabled or its model is not available. */
    UNAVAILABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
