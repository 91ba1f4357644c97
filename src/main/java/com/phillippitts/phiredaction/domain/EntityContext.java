package com.phillippitts.phiredaction.domain;

/**
 * Provenance of a detection: which chunk it was seen in and the text around it.
 *
 * @param chunkId         source chunk, or {@code null} when the span was found by a buffer-wide scan
 *                        that crossed chunk boundaries
 * @param surroundingText window of buffer text around the span
 * @param channel         capture channel of the source chunk (nullable for buffer-wide scans)
 * @param t0              audio start of the source chunk
 * @param t1              audio end of the source chunk
 */
public record EntityContext(
        String chunkId,
        String surroundingText,
        Channel channel,
        double t0,
        double t1
) {}
