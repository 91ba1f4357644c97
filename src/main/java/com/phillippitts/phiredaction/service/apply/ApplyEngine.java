package com.phillippitts.phiredaction.service.apply;

import com.phillippitts.phiredaction.domain.ApplyResult;
import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.domain.Snapshot;
import com.phillippitts.phiredaction.exception.StaleSnapshotException;
import com.phillippitts.phiredaction.exception.UnknownEntityException;
import com.phillippitts.phiredaction.service.buffer.ChunkBuffer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives redacted text from a snapshot and a reviewer's accepted entity ids.
 *
 * <p>Pure: the output depends only on the snapshot's original text and the accepted set, so
 * repeated calls yield identical text. Spans are replaced from the highest start offset down,
 * which keeps lower offsets valid while the text changes length.
 */
@Component
public class ApplyEngine {

    /**
     * Applies the accepted entities of a snapshot.
     *
     * @param snapshot snapshot under review
     * @param acceptedIds ids the reviewer accepted; {@code null} means none
     * @return redacted text and counts
     * @throws UnknownEntityException if any id is not an entity of the snapshot; no text is produced
     */
    public ApplyResult apply(Snapshot snapshot, Collection<String> acceptedIds) {
        Set<String> accepted = acceptedIds == null ? Set.of() : new LinkedHashSet<>(acceptedIds);

        Set<String> unknown = new TreeSet<>();
        List<Entity> selected = new ArrayList<>();
        for (String id : accepted) {
            snapshot.findEntity(id).ifPresentOrElse(selected::add, () -> unknown.add(String.valueOf(id)));
        }
        if (!unknown.isEmpty()) {
            throw new UnknownEntityException(snapshot.snapshotId(), unknown);
        }

        String redacted = mask(snapshot.originalText(), selected);
        return new ApplyResult(snapshot.snapshotId(), redacted, selected.size(),
                snapshot.entities().size() - selected.size(),
                snapshot.originalText().length(), redacted.length());
    }

    /**
     * Replaces each entity span with its label placeholder.
     *
     * @param text original text the entity offsets refer to
     * @param entities non-overlapping entities
     */
    public String mask(String text, Collection<Entity> entities) {
        List<Entity> ordered = new ArrayList<>(entities);
        ordered.sort(Comparator.comparingInt(Entity::start).reversed());
        StringBuilder out = new StringBuilder(text);
        for (Entity e : ordered) {
            out.replace(e.start(), e.end(), e.label().placeholder());
        }
        return out.toString();
    }

    /**
     * Verifies that a snapshot still describes the session buffer: the buffer must begin with the
     * snapshot's text and every entity's recorded text must sit at its offsets.
     *
     * @throws StaleSnapshotException on any mismatch
     */
    public void verifyFresh(Snapshot snapshot, ChunkBuffer buffer) {
        if (!buffer.startsWith(snapshot.originalText())) {
            throw new StaleSnapshotException(snapshot.snapshotId(), snapshot.sessionId(),
                    "buffer no longer starts with the snapshot text (snapshot version "
                            + snapshot.bufferVersion() + ", buffer version " + buffer.version() + ")");
        }
        String text = snapshot.originalText();
        for (Entity e : snapshot.entities()) {
            if (e.end() > text.length() || !text.regionMatches(e.start(), e.text(), 0, e.text().length())
                    || e.text().length() != e.length()) {
                throw new StaleSnapshotException(snapshot.snapshotId(), snapshot.sessionId(), e.id(),
                        "entity offsets [" + e.start() + "," + e.end() + ") do not match its recorded text");
            }
        }
    }
}
