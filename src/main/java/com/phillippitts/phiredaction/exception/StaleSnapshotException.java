package com.phillippitts.phiredaction.exception;

/**
 * Thrown when a snapshot no longer matches the buffer it was taken from, so its offsets
 * cannot be trusted. Apply refuses to produce output in that case.
 */
public class StaleSnapshotException extends PhiRedactionException {

    private final String snapshotId;
    private final String sessionId;
    private final String entityId;

    public StaleSnapshotException(String snapshotId, String sessionId, String reason) {
        this(snapshotId, sessionId, null, reason);
    }

    public StaleSnapshotException(String snapshotId, String sessionId, String entityId, String reason) {
        super("Stale snapshot " + snapshotId + " (session=" + sessionId
                + (entityId != null ? ", entity=" + entityId : "") + "): " + reason);
        this.snapshotId = snapshotId;
        this.sessionId = sessionId;
        this.entityId = entityId;
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getEntityId() {
        return entityId;
    }
}
