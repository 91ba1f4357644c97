package com.phillippitts.phiredaction.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned redaction proposal over a session buffer.
 *
 * <p>{@code redactedText} masks every entity in the snapshot; the caller's accept/reject decision
 * is applied later by the apply engine. The original text at {@code bufferVersion} is kept so
 * that apply is a pure function of the snapshot and the selection.
 *
 * @param snapshotId      unique id, embeds the buffer version
 * @param sessionId       owning session
 * @param bufferVersion   buffer version the snapshot was taken at
 * @param entities        active entities at that version, highest label precedence first
 * @param previewDiff     one entry per replaced span, ordered by start offset
 * @param previewDiffText human-readable rendering of {@code previewDiff}
 * @param originalText    buffer text at {@code bufferVersion}
 * @param originalLength  character count of the original text
 * @param redactedLength  character count of the fully masked preview
 * @param redactedText    fully masked preview
 * @param degraded        true when the slow lane did not contribute (reduced recall)
 * @param createdAt       creation time
 */
public record Snapshot(
        String snapshotId,
        String sessionId,
        long bufferVersion,
        List<Entity> entities,
        List<DiffEntry> previewDiff,
        String previewDiffText,
        String originalText,
        int originalLength,
        int redactedLength,
        String redactedText,
        boolean degraded,
        Instant createdAt
) {

    public Snapshot {
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(redactedText, "redactedText");
        Objects.requireNonNull(createdAt, "createdAt");
        entities = entities == null ? List.of() : List.copyOf(entities);
        previewDiff = previewDiff == null ? List.of() : List.copyOf(previewDiff);
        previewDiffText = previewDiffText == null ? "" : previewDiffText;
    }

    public Optional<Entity> findEntity(String entityId) {
        return entities.stream().filter(e -> e.id().equals(entityId)).findFirst();
    }
}
