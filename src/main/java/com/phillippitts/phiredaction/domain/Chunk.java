package com.phillippitts.phiredaction.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable transcript fragment as delivered by the speech-to-text layer.
 *
 * <p>Field-level validation (ordering of {@code t0}/{@code t1}, non-blank text, ingest ordering)
 * is performed by {@link com.phillippitts.phiredaction.service.buffer.ChunkValidator} so that
 * violations surface as a {@code ChunkValidationException} with session context rather than a
 * bare constructor failure.
 *
 * @param chunkId         unique chunk identifier
 * @param sessionId       owning session
 * @param channel         capture channel
 * @param text            transcript text
 * @param t0              start of the audio segment, in seconds from session start
 * @param t1              end of the audio segment, in seconds from session start
 * @param ingestTimestamp when the chunk was produced; defines buffer append order
 */
public record Chunk(
        String chunkId,
        String sessionId,
        Channel channel,
        String text,
        double t0,
        double t1,
        Instant ingestTimestamp
) {

    public Chunk {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(ingestTimestamp, "ingestTimestamp");
        if (chunkId == null || chunkId.isBlank()) {
            chunkId = UUID.randomUUID().toString();
        }
    }

    public static Chunk of(String sessionId, Channel channel, String text, double t0, double t1, Instant at) {
        return new Chunk(null, sessionId, channel, text, t0, t1, at);
    }
}
