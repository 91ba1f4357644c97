package com.phillippitts.phiredaction.domain;

/**
 * Audio channel a transcript chunk was captured from.
 *
 * <p>PRIMARY and SECONDARY are the two speakers of a dual-channel recording; MIXED is used when
 * the upstream recognizer could not separate them.
 */
public enum Channel {
    PRIMARY,
    SECONDARY,
    MIXED
}
