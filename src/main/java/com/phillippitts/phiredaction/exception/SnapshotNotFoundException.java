package com.phillippitts.phiredaction.exception;

/**
 * Thrown when a snapshot id is unknown, including snapshots discarded with their session.
 */
public class SnapshotNotFoundException extends PhiRedactionException {

    private final String snapshotId;

    public SnapshotNotFoundException(String snapshotId) {
        super("Snapshot not found: " + snapshotId);
        this.snapshotId = snapshotId;
    }

    public String getSnapshotId() {
        return snapshotId;
    }
}
