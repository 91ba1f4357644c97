package com.phillippitts.phiredaction.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when an apply request names entity ids that are not part of the referenced snapshot.
 */
public class UnknownEntityException extends PhiRedactionException {

    private final String snapshotId;
    private final Set<String> unknownIds;

    public UnknownEntityException(String snapshotId, Set<String> unknownIds) {
        super("Unknown entity ids for snapshot " + snapshotId + ": " + new TreeSet<>(unknownIds));
        this.snapshotId = snapshotId;
        this.unknownIds = Set.copyOf(unknownIds);
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public Set<String> getUnknownIds() {
        return unknownIds;
    }
}
