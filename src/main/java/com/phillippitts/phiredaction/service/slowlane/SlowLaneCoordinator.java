package com.phillippitts.phiredaction.service.slowlane;

import com.phillippitts.phiredaction.config.properties.SlowLaneProperties;
import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.exception.DetectorExceptionBuilder;
import com.phillippitts.phiredaction.exception.DetectorTimeoutException;
import com.phillippitts.phiredaction.exception.DetectorUnavailableException;
import com.phillippitts.phiredaction.exception.PhiRedactionException;
import com.phillippitts.phiredaction.service.buffer.BufferView;
import com.phillippitts.phiredaction.service.detect.slow.ContextualDetector;
import com.phillippitts.phiredaction.service.detect.watchdog.DetectorFailureEvent;
import com.phillippitts.phiredaction.service.detect.watchdog.DetectorWatchdog;
import com.phillippitts.phiredaction.service.merge.EntityMerger;
import com.phillippitts.phiredaction.service.merge.MergeResult;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.service.session.RedactionSession;
import com.phillippitts.phiredaction.service.session.SessionRegistry;
import com.phillippitts.phiredaction.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Schedules and runs contextual slow-lane passes per session.
 *
 * <p><b>Cadence:</b> a pass is requested when more than {@code char-threshold} characters were
 * appended since the last pass started (checked on every append), or when {@code interval-ms}
 * elapsed since the last pass and new text exists (checked by a scheduled tick).
 *
 * <p><b>Coalescing:</b> at most one pass per session is in flight. A request that arrives while
 * a pass runs sets a single deferred flag; exactly one follow-up pass runs afterwards over the
 * then-current buffer. A request the saturated slow-lane pool rejects sets the same flag and is
 * retried by the next tick, so the requesting thread never runs a pass.
 *
 * <p><b>Thread Model:</b> passes are coordinated on {@code slowLaneExecutor}. The buffer is copied
 * under the session lock, the model runs on {@code detectorExecutor} bounded by
 * {@code pass-timeout-ms} (interrupted when abandoned) and the merge runs under the session lock
 * again. Text appended while the model ran is picked up by the next pass; offsets stay valid
 * because the buffer is append-only.
 *
 * <p><b>Failures:</b> a timeout abandons the pass and counts against the session as a
 * {@link DetectorTimeoutException}; reaching
 * {@code failure-threshold} consecutive failures marks the session persistently degraded.
 * An unavailable model is reported to the {@link DetectorWatchdog} through a
 * {@link DetectorFailureEvent}; sessions keep ingesting with the fast lane only.
 */
@Component
public class SlowLaneCoordinator {

    private static final Logger LOG = LogManager.getLogger(SlowLaneCoordinator.class);

    private final SlowLaneProperties props;
    private final ContextualDetector detector;
    private final EntityMerger merger;
    private final DetectorWatchdog watchdog;
    private final SessionRegistry registry;
    private final Executor slowLaneExecutor;
    private final AsyncTaskExecutor detectorExecutor;
    private final ApplicationEventPublisher publisher;
    private final RedactionMetrics metrics;
    private final Clock clock;

    public SlowLaneCoordinator(SlowLaneProperties props,
                               ContextualDetector detector,
                               EntityMerger merger,
                               DetectorWatchdog watchdog,
                               SessionRegistry registry,
                               @Qualifier("slowLaneExecutor") Executor slowLaneExecutor,
                               @Qualifier("detectorExecutor") AsyncTaskExecutor detectorExecutor,
                               ApplicationEventPublisher publisher,
                               RedactionMetrics metrics,
                               Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.detector = Objects.requireNonNull(detector);
        this.merger = Objects.requireNonNull(merger);
        this.watchdog = Objects.requireNonNull(watchdog);
        this.registry = Objects.requireNonNull(registry);
        this.slowLaneExecutor = Objects.requireNonNull(slowLaneExecutor);
        this.detectorExecutor = Objects.requireNonNull(detectorExecutor);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Returns whether slow-lane passes can currently run.
     */
    public boolean isAvailable() {
        return props.isEnabled() && watchdog.isAvailable();
    }

    /**
     * Returns whether snapshots of this session must be marked degraded.
     */
    public boolean isDegraded(RedactionSession session) {
        return !isAvailable() || session.isPersistentlyDegraded();
    }

    /**
     * Volume trigger, called after every append.
     */
    public void onAppend(RedactionSession session) {
        if (!isAvailable()) {
            return;
        }
        if (session.buffer().length() - session.lengthAtLastPass() > props.getCharThreshold()) {
            requestPass(session);
        }
    }

    /**
     * Interval trigger: requests a pass for every idle session whose interval elapsed and whose
     * buffer grew since its last pass, and for every session whose pass was deferred.
     */
    @Scheduled(fixedDelayString = "${phi.slow-lane.tick-ms:1000}")
    public void tick() {
        if (!isAvailable()) {
            return;
        }
        long now = clock.millis();
        for (RedactionSession session : registry.all()) {
            if (session.isPassInFlight()) {
                continue;
            }
            boolean intervalElapsed = now - session.lastPassAtMillis() >= props.getIntervalMs();
            boolean newText = session.buffer().length() > session.lengthAtLastPass();
            boolean deferred = session.takePending();
            if ((intervalElapsed && newText) || deferred) {
                requestPass(session);
            }
        }
    }

    /**
     * Manual trigger. When the model is down this also asks the watchdog for a restart.
     */
    public SlowPassStatus forcePass(RedactionSession session) {
        if (props.isEnabled() && !isAvailable()) {
            publisher.publishEvent(new DetectorFailureEvent(detector.modelName(), clock.instant(),
                    "Forced pass requested while model unavailable", null,
                    Map.of("session", session.sessionId())));
        }
        return requestPass(session);
    }

    /**
     * Requests a pass, coalescing with a running one.
     */
    public SlowPassStatus requestPass(RedactionSession session) {
        if (!isAvailable()) {
            metrics.incrementSlowPass("unavailable");
            return SlowPassStatus.UNAVAILABLE;
        }
        if (!session.tryStartPass()) {
            session.markPending();
            metrics.incrementSlowPass("coalesced");
            LOG.debug("Slow-lane pass for session {} coalesced into the running pass", session.sessionId());
            return SlowPassStatus.COALESCED;
        }
        try {
            slowLaneExecutor.execute(() -> drain(session));
        } catch (RejectedExecutionException e) {
            session.finishPass();
            session.markPending();
            LOG.warn("Slow-lane pool saturated; pass for session {} deferred to the next tick",
                    session.sessionId());
            metrics.incrementSlowPass("deferred");
            return SlowPassStatus.COALESCED;
        }
        return SlowPassStatus.ACCEPTED;
    }

    /**
     * Runs passes while requests keep arriving. The caller owns the in-flight slot.
     */
    private void drain(RedactionSession session) {
        ThreadContext.put("sessionId", session.sessionId());
        try {
            do {
                try {
                    do {
                        runPass(session);
                    } while (session.takePending());
                } finally {
                    session.finishPass();
                }
                // a request may have been marked between the last check and finishPass
            } while (session.takePending() && session.tryStartPass());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * One pass: copy, scan with a time budget, merge.
     */
    void runPass(RedactionSession session) {
        BufferView view = session.withLock(() -> session.buffer().view());
        session.recordPassStart(view.length(), clock.millis());
        if (view.length() == 0) {
            return;
        }
        if (!isAvailable()) {
            metrics.incrementSlowPass("unavailable");
            return;
        }

        long startNanos = System.nanoTime();
        Future<List<Detection>> future;
        try {
            future = detectorExecutor.submit(() -> detector.scanFull(view.text(), session.buffer()));
        } catch (RejectedExecutionException e) {
            DetectorUnavailableException saturated = DetectorExceptionBuilder.create("Detector pool saturated")
                    .detector(detector.modelName())
                    .session(session.sessionId())
                    .metadata("bufferVersion", view.version())
                    .cause(e)
                    .buildUnavailable();
            LOG.warn("Slow-lane pass skipped: {}", saturated.getMessage());
            onFailure(session, "rejected", saturated);
            return;
        }

        List<Detection> detections;
        try {
            detections = future.get(props.getPassTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            DetectorTimeoutException timeout = DetectorExceptionBuilder.create("Slow-lane pass timed out")
                    .detector(detector.modelName())
                    .session(session.sessionId())
                    .durationMs(TimeUtils.elapsedMillis(startNanos))
                    .metadata("bufferVersion", view.version())
                    .cause(te)
                    .buildTimeout(props.getPassTimeoutMs());
            LOG.warn("Abandoned slow-lane pass: {}", timeout.getMessage());
            onFailure(session, "timeout", timeout);
            return;
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            onUnavailable(session, cause);
            return;
        }

        final List<Detection> found = detections;
        MergeResult result = session.withLock(() -> {
            MergeResult r = merger.merge(session.index().active(), found, session.index()::nextId);
            session.index().apply(r);
            return r;
        });
        session.recordSuccess();
        metrics.incrementSlowPass("success");
        metrics.incrementMerge("added", result.added().size());
        metrics.incrementMerge("superseded", result.superseded().size());
        metrics.incrementMerge("duplicate", result.duplicates());
        metrics.incrementMerge("rejected", result.rejected());
        LOG.debug("Slow-lane pass for session {} at version {} took {} ms: {} detections, {} added, {} superseded",
                session.sessionId(), view.version(), TimeUtils.elapsedMillis(startNanos), detections.size(),
                result.added().size(), result.superseded().size());
    }

    private void onFailure(RedactionSession session, String reason, PhiRedactionException failure) {
        metrics.incrementSlowPass(reason);
        int failures = session.recordFailure(failure);
        if (failures >= props.getFailureThreshold() && !session.isPersistentlyDegraded()) {
            session.markPersistentlyDegraded();
            LOG.error("Session {} marked degraded after {} consecutive slow-lane failures; last: {}",
                    session.sessionId(), failures, failure.getMessage());
        }
    }

    private void onUnavailable(RedactionSession session, Throwable cause) {
        metrics.incrementSlowPass("unavailable");
        String message = cause instanceof DetectorUnavailableException
                ? cause.getMessage()
                : "Unexpected context model failure: " + (cause == null ? "unknown" : cause.getClass().getSimpleName());
        LOG.warn("Slow lane unavailable for session {}: {}", session.sessionId(), message);
        publisher.publishEvent(new DetectorFailureEvent(detector.modelName(), clock.instant(), message, cause,
                Map.of("session", session.sessionId())));
    }
}
