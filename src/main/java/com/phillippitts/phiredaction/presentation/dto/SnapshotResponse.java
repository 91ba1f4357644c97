package com.phillippitts.phiredaction.presentation.dto;

import com.phillippitts.phiredaction.domain.DiffEntry;
import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.domain.Snapshot;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot as returned to reviewers. The original text is not repeated; each diff entry already
 * carries the span it would replace.
 */
public record SnapshotResponse(
        String snapshotId,
        String sessionId,
        long bufferVersion,
        List<Entity> entities,
        List<DiffEntry> previewDiff,
        String previewDiffText,
        int originalLength,
        int redactedLength,
        String redactedText,
        boolean degraded,
        Instant createdAt
) {
    public static SnapshotResponse from(Snapshot s) {
        return new SnapshotResponse(s.snapshotId(), s.sessionId(), s.bufferVersion(), s.entities(),
                s.previewDiff(), s.previewDiffText(), s.originalLength(), s.redactedLength(), s.redactedText(),
                s.degraded(), s.createdAt());
    }
}
