package com.phillippitts.phiredaction.service.buffer;

import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.exception.ChunkValidationException;
import org.springframework.stereotype.Component;

/**
 * Validates a transcript chunk's own fields before it reaches a buffer.
 *
 * <p>Ordering against previously appended chunks is checked by {@link ChunkBuffer#append(Chunk)},
 * which owns the last ingest timestamp.
 */
@Component
public class ChunkValidator {

    private final FastLaneProperties props;

    public ChunkValidator(FastLaneProperties props) {
        this.props = props;
    }

    /**
     * @param chunk chunk to check
     * @throws ChunkValidationException when text is blank or too long, or times are inconsistent
     */
    public void validate(Chunk chunk) {
        if (chunk == null) {
            throw new ChunkValidationException("unknown", "unknown", "Chunk is null");
        }
        if (chunk.text() == null || chunk.text().isBlank()) {
            throw new ChunkValidationException(chunk.sessionId(), chunk.chunkId(), "Chunk text is empty");
        }
        if (chunk.text().length() > props.getMaxChunkChars()) {
            throw new ChunkValidationException(chunk.sessionId(), chunk.chunkId(),
                    "Chunk too long: " + chunk.text().length() + " chars. Max: " + props.getMaxChunkChars());
        }
        if (Double.isNaN(chunk.t0()) || Double.isNaN(chunk.t1())) {
            throw new ChunkValidationException(chunk.sessionId(), chunk.chunkId(), "Chunk times must be numbers");
        }
        if (chunk.t1() < chunk.t0()) {
            throw new ChunkValidationException(chunk.sessionId(), chunk.chunkId(),
                    "Chunk ends before it starts (t0=" + chunk.t0() + ", t1=" + chunk.t1() + ")");
        }
    }
}
