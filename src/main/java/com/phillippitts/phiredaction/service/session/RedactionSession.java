package com.phillippitts.phiredaction.service.session;

import com.phillippitts.phiredaction.domain.Snapshot;
import com.phillippitts.phiredaction.exception.PhiRedactionException;
import com.phillippitts.phiredaction.service.buffer.ChunkBuffer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State of one redaction session: buffer, entity index, snapshot history and slow-lane
 * bookkeeping.
 *
 * <p>Buffer appends, index merges and snapshot reads run under {@link #withLock(Supplier)}.
 * Slow-lane flags are atomics so the scheduler can read them without taking the lock.
 */
public final class RedactionSession {

    private final String sessionId;
    private final Instant createdAt;
    private final ChunkBuffer buffer;
    private final EntityIndex index = new EntityIndex();
    private final List<Snapshot> snapshots = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicBoolean passInFlight = new AtomicBoolean(false);
    private final AtomicBoolean passPending = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean persistentlyDegraded = false;
    private volatile PhiRedactionException lastFailure;
    private volatile int lengthAtLastPass = 0;
    private volatile long lastPassAtMillis;
    private volatile Instant lastActivity;

    public RedactionSession(String sessionId, String chunkSeparator, Instant now) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.createdAt = now;
        this.lastActivity = now;
        this.lastPassAtMillis = now.toEpochMilli();
        this.buffer = new ChunkBuffer(sessionId, chunkSeparator);
    }

    /**
     * Runs {@code action} while holding the session lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ChunkBuffer buffer() {
        return buffer;
    }

    /** Guarded by the session lock. */
    public EntityIndex index() {
        return index;
    }

    /** Guarded by the session lock. */
    public void addSnapshot(Snapshot snapshot) {
        snapshots.add(snapshot);
    }

    /** Guarded by the session lock. */
    public List<Snapshot> snapshots() {
        return List.copyOf(snapshots);
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    // ---- slow-lane bookkeeping ----

    /**
     * Claims the single in-flight pass slot.
     *
     * @return true if the caller now owns the pass; false if one is already running
     */
    public boolean tryStartPass() {
        return passInFlight.compareAndSet(false, true);
    }

    public void finishPass() {
        passInFlight.set(false);
    }

    public boolean isPassInFlight() {
        return passInFlight.get();
    }

    /** Records a request that arrived while a pass was running. At most one is kept. */
    public void markPending() {
        passPending.set(true);
    }

    /** Returns and clears the deferred request flag. */
    public boolean takePending() {
        return passPending.getAndSet(false);
    }

    public void recordPassStart(int bufferLength, long nowMillis) {
        this.lengthAtLastPass = bufferLength;
        this.lastPassAtMillis = nowMillis;
    }

    public int lengthAtLastPass() {
        return lengthAtLastPass;
    }

    public long lastPassAtMillis() {
        return lastPassAtMillis;
    }

    /**
     * Counts a failed pass and remembers why it failed.
     *
     * @return consecutive failures including this one
     */
    public int recordFailure(PhiRedactionException failure) {
        this.lastFailure = failure;
        return consecutiveFailures.incrementAndGet();
    }

    /** The most recent slow-lane failure; kept after later successes. */
    public Optional<PhiRedactionException> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    /** Once set, stays set for the lifetime of the session. */
    public void markPersistentlyDegraded() {
        this.persistentlyDegraded = true;
    }

    public boolean isPersistentlyDegraded() {
        return persistentlyDegraded;
    }
}
