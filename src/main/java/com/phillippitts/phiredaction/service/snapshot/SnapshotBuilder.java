package com.phillippitts.phiredaction.service.snapshot;

import com.phillippitts.phiredaction.domain.DiffEntry;
import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.domain.Snapshot;
import com.phillippitts.phiredaction.service.apply.ApplyEngine;
import com.phillippitts.phiredaction.service.buffer.BufferView;
import com.phillippitts.phiredaction.service.session.RedactionSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Builds immutable snapshots of a session.
 *
 * <p>Buffer text, version and active entities are read under the session lock so the three are
 * mutually consistent. The proposal masks every active entity. Entities are listed by label
 * precedence while the preview diff follows the text. Each call issues a new snapshot id and
 * appends the snapshot to the session history.
 */
@Component
public class SnapshotBuilder {

    private final ApplyEngine applyEngine;
    private final Clock clock;

    public SnapshotBuilder(ApplyEngine applyEngine, Clock clock) {
        this.applyEngine = applyEngine;
        this.clock = clock;
    }

    /**
     * @param session session to capture
     * @param degraded whether the slow lane did not contribute to this snapshot
     */
    public Snapshot build(RedactionSession session, boolean degraded) {
        return session.withLock(() -> {
            BufferView view = session.buffer().view();
            List<Entity> entities = session.index().activeByPrecedence();
            String redacted = applyEngine.mask(view.text(), entities);
            List<DiffEntry> diff = session.index().activeByStart().stream()
                    .map(e -> new DiffEntry(e.id(), e.label(), e.start(), e.end(), e.text(), e.label().placeholder()))
                    .toList();
            Snapshot snapshot = new Snapshot(
                    "snap-v" + view.version() + "-" + UUID.randomUUID(),
                    session.sessionId(),
                    view.version(),
                    entities,
                    diff,
                    PreviewDiffRenderer.render(diff),
                    view.text(),
                    view.length(),
                    redacted.length(),
                    redacted,
                    degraded,
                    clock.instant());
            session.addSnapshot(snapshot);
            return snapshot;
        });
    }
}
