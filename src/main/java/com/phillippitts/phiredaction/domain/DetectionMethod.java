package com.phillippitts.phiredaction.domain;

/**
 * Which detection lane produced an entity.
 */
public enum DetectionMethod {

    /** Fast lane: deterministic pattern matching over a single chunk. */
    PATTERN,

    /** Slow lane: context-model scan over the accumulated buffer. */
    CONTEXTUAL
}
