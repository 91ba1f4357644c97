package com.phillippitts.phiredaction.presentation.dto;

import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.service.IngestResult;

import java.util.List;

public record IngestResponse(
        String sessionId,
        String chunkId,
        long bufferVersion,
        int baseOffset,
        List<Entity> fastLaneEntities
) {
    public static IngestResponse from(IngestResult result) {
        return new IngestResponse(result.sessionId(), result.chunkId(), result.bufferVersion(),
                result.baseOffset(), result.fastLaneEntities());
    }
}
