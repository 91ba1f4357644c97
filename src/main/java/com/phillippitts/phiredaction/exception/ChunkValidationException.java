package com.phillippitts.phiredaction.exception;

/**
 * Thrown when an ingested chunk is malformed or arrives out of order.
 * The caller must fix or re-send the chunk in order; it is never reordered silently.
 */
public class ChunkValidationException extends PhiRedactionException {

    private final String sessionId;
    private final String chunkId;
    private final String reason;

    public ChunkValidationException(String sessionId, String chunkId, String reason) {
        super("Invalid chunk (session=" + sessionId + ", chunk=" + chunkId + "): " + reason);
        this.sessionId = sessionId;
        this.chunkId = chunkId;
        this.reason = reason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getChunkId() {
        return chunkId;
    }

    public String getReason() {
        return reason;
    }
}
