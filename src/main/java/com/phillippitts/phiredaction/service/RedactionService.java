package com.phillippitts.phiredaction.service;

import com.phillippitts.phiredaction.domain.ApplyResult;
import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.domain.Snapshot;
import com.phillippitts.phiredaction.exception.ChunkValidationException;
import com.phillippitts.phiredaction.exception.SessionNotFoundException;
import com.phillippitts.phiredaction.exception.SnapshotNotFoundException;
import com.phillippitts.phiredaction.exception.StaleSnapshotException;
import com.phillippitts.phiredaction.exception.UnknownEntityException;
import com.phillippitts.phiredaction.service.apply.ApplyEngine;
import com.phillippitts.phiredaction.service.buffer.AppendResult;
import com.phillippitts.phiredaction.service.buffer.ChunkValidator;
import com.phillippitts.phiredaction.service.detect.fast.PatternDetector;
import com.phillippitts.phiredaction.service.merge.EntityMerger;
import com.phillippitts.phiredaction.service.merge.MergeResult;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.service.session.RedactionSession;
import com.phillippitts.phiredaction.service.session.SessionRegistry;
import com.phillippitts.phiredaction.service.slowlane.SlowLaneCoordinator;
import com.phillippitts.phiredaction.service.slowlane.SlowPassStatus;
import com.phillippitts.phiredaction.service.snapshot.SnapshotBuilder;
import com.phillippitts.phiredaction.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Facade over the redaction pipeline, used by the REST layer and the policy gate.
 *
 * <p>Ingest path: validate, append under the session lock, scan the chunk with the fast lane on
 * the caller thread, merge under the lock, then let the slow lane decide whether a pass is due.
 * Ingestion never waits for the slow lane.
 */
@Service
public class RedactionService {

    private static final Logger LOG = LogManager.getLogger(RedactionService.class);

    private final ChunkValidator validator;
    private final SessionRegistry registry;
    private final PatternDetector patternDetector;
    private final EntityMerger merger;
    private final SlowLaneCoordinator slowLane;
    private final SnapshotBuilder snapshotBuilder;
    private final ApplyEngine applyEngine;
    private final RedactionMetrics metrics;
    private final Clock clock;

    public RedactionService(ChunkValidator validator,
                            SessionRegistry registry,
                            PatternDetector patternDetector,
                            EntityMerger merger,
                            SlowLaneCoordinator slowLane,
                            SnapshotBuilder snapshotBuilder,
                            ApplyEngine applyEngine,
                            RedactionMetrics metrics,
                            Clock clock) {
        this.validator = validator;
        this.registry = registry;
        this.patternDetector = patternDetector;
        this.merger = merger;
        this.slowLane = slowLane;
        this.snapshotBuilder = snapshotBuilder;
        this.applyEngine = applyEngine;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Appends a chunk to its session (created on first use) and runs the fast lane over it.
     *
     * @throws ChunkValidationException if the chunk is malformed or out of order
     */
    public IngestResult ingest(Chunk chunk) {
        validator.validate(chunk);
        RedactionSession session = registry.getOrCreate(chunk.sessionId());
        AppendResult appended = session.withLock(() -> session.buffer().append(chunk));
        session.touch(clock.instant());
        LOG.debug("Appended chunk {} ({}) at [{},{}), version {}", chunk.chunkId(),
                LogSanitizer.describe(chunk.text()), appended.baseOffset(), appended.endOffset(),
                appended.version());

        List<Detection> detections = patternDetector.scan(chunk, appended.baseOffset());
        MergeResult merged = session.withLock(() -> {
            MergeResult r = merger.merge(session.index().active(), detections, session.index()::nextId);
            session.index().apply(r);
            return r;
        });
        metrics.incrementMerge("added", merged.added().size());
        metrics.incrementMerge("superseded", merged.superseded().size());
        metrics.incrementMerge("duplicate", merged.duplicates());
        metrics.incrementMerge("rejected", merged.rejected());

        slowLane.onAppend(session);
        return new IngestResult(session.sessionId(), chunk.chunkId(), appended.version(),
                appended.baseOffset(), merged.added());
    }

    /**
     * Manually requests a slow-lane pass.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public SlowPassStatus forceSlowPass(String sessionId) {
        RedactionSession session = registry.get(sessionId);
        SlowPassStatus status = slowLane.forcePass(session);
        LOG.info("Forced slow-lane pass for session {}: {}", sessionId, status);
        return status;
    }

    /**
     * Builds a fresh snapshot; every call yields a new id.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public Snapshot snapshot(String sessionId) {
        RedactionSession session = registry.get(sessionId);
        Snapshot snapshot = snapshotBuilder.build(session, slowLane.isDegraded(session));
        registry.registerSnapshot(snapshot.snapshotId(), sessionId);
        session.touch(clock.instant());
        LOG.info("Snapshot {} built for session {}: version={}, entities={}, degraded={}",
                snapshot.snapshotId(), sessionId, snapshot.bufferVersion(), snapshot.entities().size(),
                snapshot.degraded());
        return snapshot;
    }

    /**
     * Looks up a previously issued snapshot.
     *
     * @throws SnapshotNotFoundException if unknown or its session ended
     */
    public Snapshot findSnapshot(String snapshotId) {
        RedactionSession session = registry.sessionForSnapshot(snapshotId);
        return session.withLock(() -> session.snapshots()).stream()
                .filter(s -> s.snapshotId().equals(snapshotId))
                .findFirst()
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    /**
     * Applies accepted entities of a snapshot after verifying it still matches the buffer.
     *
     * @throws SnapshotNotFoundException if the snapshot is unknown
     * @throws StaleSnapshotException if the buffer no longer matches the snapshot
     * @throws UnknownEntityException if an accepted id is not part of the snapshot
     */
    public ApplyResult apply(String snapshotId, Collection<String> acceptedIds) {
        Snapshot snapshot = findSnapshot(snapshotId);
        RedactionSession session = registry.sessionForSnapshot(snapshotId);
        try {
            applyEngine.verifyFresh(snapshot, session.buffer());
        } catch (StaleSnapshotException e) {
            metrics.incrementApply("stale");
            LOG.warn("Rejected apply on stale snapshot {}: {}", snapshotId, e.getMessage());
            throw e;
        }
        ApplyResult result;
        try {
            result = applyEngine.apply(snapshot, acceptedIds);
        } catch (UnknownEntityException e) {
            metrics.incrementApply("unknown_entity");
            LOG.warn("Rejected apply on snapshot {}: unknown entity ids {}", snapshotId, e.getUnknownIds());
            throw e;
        }
        session.touch(clock.instant());
        metrics.incrementApply("applied");
        LOG.info("Applied snapshot {}: accepted={}, rejected={}, originalLength={}, redactedLength={}",
                snapshotId, result.acceptedCount(), result.rejectedCount(), result.originalLength(),
                result.redactedLength());
        return result;
    }

    /**
     * Discards a session's buffer, index and snapshots.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public void endSession(String sessionId) {
        registry.end(sessionId);
    }

    public boolean isSlowLaneAvailable() {
        return slowLane.isAvailable();
    }

    /**
     * True when the slow lane is unavailable or any live session is persistently degraded.
     */
    public boolean isDegraded() {
        return !slowLane.isAvailable()
                || registry.all().stream().anyMatch(RedactionSession::isPersistentlyDegraded);
    }

    public int activeSessions() {
        return registry.activeCount();
    }
}
