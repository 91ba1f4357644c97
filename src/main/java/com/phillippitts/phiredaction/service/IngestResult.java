package com.phillippitts.phiredaction.service;

import com.phillippitts.phiredaction.domain.Entity;

import java.util.List;

/**
 * Outcome of ingesting one chunk.
 *
 * @param sessionId         owning session
 * @param chunkId           id of the appended chunk (generated when the caller sent none)
 * @param bufferVersion     buffer version after the append
 * @param baseOffset        buffer offset of the chunk's first character
 * @param fastLaneEntities  entities created by the fast-lane scan of this chunk
 */
public record IngestResult(
        String sessionId,
        String chunkId,
        long bufferVersion,
        int baseOffset,
        List<Entity> fastLaneEntities
) {
    public IngestResult {
        fastLaneEntities = List.copyOf(fastLaneEntities);
    }
}
