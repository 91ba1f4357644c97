package com.phillippitts.phiredaction.service.slowlane;

import com.phillippitts.phiredaction.config.ThreadPoolConfig;
import com.phillippitts.phiredaction.config.properties.DetectorWatchdogProperties;
import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.config.properties.SessionProperties;
import com.phillippitts.phiredaction.config.properties.SlowLaneProperties;
import com.phillippitts.phiredaction.config.properties.ThreadPoolProperties;
import com.phillippitts.phiredaction.domain.Entity;
import com.phillippitts.phiredaction.domain.PhiLabel;
import com.phillippitts.phiredaction.exception.DetectorTimeoutException;
import com.phillippitts.phiredaction.service.detect.slow.ContextualDetector;
import com.phillippitts.phiredaction.service.detect.slow.LabelMapper;
import com.phillippitts.phiredaction.service.detect.slow.ModelAnnotation;
import com.phillippitts.phiredaction.service.detect.watchdog.DetectorFailureEvent;
import com.phillippitts.phiredaction.service.detect.watchdog.DetectorWatchdog;
import com.phillippitts.phiredaction.service.merge.EntityMerger;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.service.session.RedactionSession;
import com.phillippitts.phiredaction.service.session.SessionRegistry;
import com.phillippitts.phiredaction.testutil.EventCapturingPublisher;
import com.phillippitts.phiredaction.testutil.FakeContextModel;
import com.phillippitts.phiredaction.testutil.MutableClock;
import com.phillippitts.phiredaction.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static com.phillippitts.phiredaction.testutil.TestChunks.T0;
import static com.phillippitts.phiredaction.testutil.TestChunks.chunk;
import static org.assertj.core.api.Assertions.assertThat;

class SlowLaneCoordinatorTest {

    private SlowLaneProperties props;
    private FakeContextModel model;
    private SimpleMeterRegistry meterRegistry;
    private RedactionMetrics metrics;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private SessionRegistry registry;
    private ContextualDetector detector;
    private DetectorWatchdog watchdog;
    private final AtomicInteger seq = new AtomicInteger();

    @BeforeEach
    void setUp() {
        props = new SlowLaneProperties();
        props.setCharThreshold(20);
        props.setIntervalMs(1_000);
        props.setPassTimeoutMs(5_000);
        props.setFailureThreshold(2);
        model = new FakeContextModel("fake", SlowLaneCoordinatorTest::findJohnSmith);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new RedactionMetrics(meterRegistry);
        publisher = new EventCapturingPublisher();
        clock = new MutableClock(T0);
        registry = new SessionRegistry(new SessionProperties(), clock);
        detector = new ContextualDetector(model, new LabelMapper(metrics), metrics, new FastLaneProperties());
        watchdog = new DetectorWatchdog(model, new DetectorWatchdogProperties(), publisher, clock);
    }

    private static List<ModelAnnotation> findJohnSmith(String text) {
        int i = text.indexOf("John Smith");
        return i < 0 ? List.of() : List.of(new ModelAnnotation("PER", i, i + 10, 0.9));
    }

    private SlowLaneCoordinator coordinator(Executor slowLaneExecutor, AsyncTaskExecutor detectorExecutor) {
        return new SlowLaneCoordinator(props, detector, new EntityMerger(), watchdog, registry,
                slowLaneExecutor, detectorExecutor, publisher, metrics, clock);
    }

    private SlowLaneCoordinator syncCoordinator() {
        return coordinator(new SyncExecutor(), new TaskExecutorAdapter(new SyncExecutor()));
    }

    private void append(RedactionSession session, String text) {
        int n = seq.getAndIncrement();
        session.withLock(() -> session.buffer().append(chunk(session.sessionId(), "c-" + n, text, n)));
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).as("condition reached within 5s").isTrue();
    }

    @Test
    void forcedPassMergesContextualEntities() {
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John");
        append(session, "Smith at 555-123-4567");

        SlowPassStatus status = coordinator.forcePass(session);

        assertThat(status).isEqualTo(SlowPassStatus.ACCEPTED);
        List<Entity> active = session.withLock(() -> session.index().active());
        assertThat(active).singleElement().satisfies(e -> {
            assertThat(e.label()).isEqualTo(PhiLabel.PERSON);
            assertThat(e.text()).isEqualTo("John Smith");
            assertThat(e.start()).isEqualTo(5);
        });
        assertThat(session.isPassInFlight()).isFalse();
        assertThat(session.lengthAtLastPass()).isEqualTo(31);
        assertThat(coordinator.isDegraded(session)).isFalse();
    }

    @Test
    void volumeTriggerFiresOnceThresholdExceeded() {
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");

        append(session, "short text");
        coordinator.onAppend(session);
        assertThat(model.annotateCalls.get()).isZero();

        append(session, "Call John Smith now");
        coordinator.onAppend(session);
        assertThat(model.annotateCalls.get()).isEqualTo(1);

        append(session, "ok");
        coordinator.onAppend(session);
        assertThat(model.annotateCalls.get()).isEqualTo(1);
    }

    @Test
    void intervalTriggerRequiresElapsedTimeAndNewText() {
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John Smith");

        clock.advance(Duration.ofMillis(500));
        coordinator.tick();
        assertThat(model.annotateCalls.get()).isZero();

        clock.advance(Duration.ofMillis(600));
        coordinator.tick();
        assertThat(model.annotateCalls.get()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(2));
        coordinator.tick();
        assertThat(model.annotateCalls.get()).isEqualTo(1);

        append(session, "again");
        clock.advance(Duration.ofSeconds(1));
        coordinator.tick();
        assertThat(model.annotateCalls.get()).isEqualTo(2);
    }

    @Test
    void requestsDuringRunningPassCoalesceIntoOneFollowUp() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        model.behaviour = text -> {
            if (model.annotateCalls.get() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return findJohnSmith(text);
        };
        ExecutorService slowPool = Executors.newSingleThreadExecutor();
        ExecutorService detectorPool = Executors.newCachedThreadPool();
        try {
            SlowLaneCoordinator coordinator = coordinator(slowPool, new TaskExecutorAdapter(detectorPool));
            RedactionSession session = registry.getOrCreate("s-1");
            append(session, "Call John");

            assertThat(coordinator.requestPass(session)).isEqualTo(SlowPassStatus.ACCEPTED);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            append(session, "Smith tomorrow");
            assertThat(coordinator.requestPass(session)).isEqualTo(SlowPassStatus.COALESCED);
            assertThat(coordinator.requestPass(session)).isEqualTo(SlowPassStatus.COALESCED);
            release.countDown();

            waitUntil(() -> model.annotateCalls.get() >= 2 && !session.isPassInFlight());
            assertThat(model.annotateCalls.get()).isEqualTo(2);
            // the follow-up pass saw the text appended while the first one ran
            assertThat(session.withLock(() -> session.index().active()))
                    .extracting(Entity::text).containsExactly("John Smith");
        } finally {
            slowPool.shutdownNow();
            detectorPool.shutdownNow();
        }
    }

    @Test
    void timedOutPassesDegradeSessionPersistently() throws Exception {
        props.setPassTimeoutMs(50);
        model.delayMs = 5_000;
        ExecutorService detectorPool = Executors.newCachedThreadPool();
        try {
            SlowLaneCoordinator coordinator = coordinator(new SyncExecutor(), new TaskExecutorAdapter(detectorPool));
            RedactionSession session = registry.getOrCreate("s-1");
            append(session, "Call John Smith");

            coordinator.forcePass(session);

            assertThat(session.consecutiveFailures()).isEqualTo(1);
            assertThat(session.isPersistentlyDegraded()).isFalse();
            assertThat(session.lastFailure()).get().isInstanceOfSatisfying(DetectorTimeoutException.class, e -> {
                assertThat(e.getTimeoutMs()).isEqualTo(50);
                assertThat(e.getDetectorName()).isEqualTo("fake");
                assertThat(e.getMessage()).contains("session=s-1").contains("bufferVersion=1");
            });
            assertThat(session.withLock(() -> session.index().active())).isEmpty();
            waitUntil(() -> model.interrupted);

            coordinator.forcePass(session);
            assertThat(session.isPersistentlyDegraded()).isTrue();
            assertThat(coordinator.isDegraded(session)).isTrue();

            model.delayMs = 0;
            coordinator.forcePass(session);
            assertThat(session.consecutiveFailures()).isZero();
            assertThat(session.isPersistentlyDegraded()).isTrue();
            assertThat(session.withLock(() -> session.index().active())).hasSize(1);
            assertThat(meterRegistry.counter("phiredaction.slowlane.pass", "outcome", "timeout").count())
                    .isEqualTo(2.0);
        } finally {
            detectorPool.shutdownNow();
        }
    }

    @Test
    void unavailableModelReportsFailureToWatchdog() {
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John Smith");
        model.healthy = false;

        SlowPassStatus status = coordinator.forcePass(session);

        assertThat(status).isEqualTo(SlowPassStatus.UNAVAILABLE);
        assertThat(publisher.findAll(DetectorFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.detector()).isEqualTo("fake"));
        assertThat(model.annotateCalls.get()).isZero();
        assertThat(coordinator.isDegraded(session)).isTrue();
    }

    @Test
    void modelCrashDuringPassPublishesFailureWithoutCountingTimeout() {
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John Smith");
        model.failWith = new IllegalStateException("boom");

        SlowPassStatus status = coordinator.forcePass(session);

        assertThat(status).isEqualTo(SlowPassStatus.ACCEPTED);
        assertThat(publisher.findAll(DetectorFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("Context model failed"));
        assertThat(session.consecutiveFailures()).isZero();
        assertThat(session.isPassInFlight()).isFalse();
    }

    @Test
    void disabledSlowLaneNeverRunsPasses() {
        props.setEnabled(false);
        SlowLaneCoordinator coordinator = syncCoordinator();
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John Smith and then some more text to pass the threshold");

        coordinator.onAppend(session);
        clock.advance(Duration.ofSeconds(10));
        coordinator.tick();

        assertThat(coordinator.forcePass(session)).isEqualTo(SlowPassStatus.UNAVAILABLE);
        assertThat(model.annotateCalls.get()).isZero();
        assertThat(publisher.findAll(DetectorFailureEvent.class)).isEmpty();
        assertThat(coordinator.isAvailable()).isFalse();
        assertThat(coordinator.isDegraded(session)).isTrue();
    }

    @Test
    void rejectedPassReleasesSlotAndRunsOnNextTick() {
        AtomicInteger rejections = new AtomicInteger(1);
        SyncExecutor sync = new SyncExecutor();
        SlowLaneCoordinator coordinator = coordinator(
                command -> {
                    if (rejections.getAndDecrement() > 0) {
                        throw new RejectedExecutionException("full");
                    }
                    sync.execute(command);
                },
                new TaskExecutorAdapter(new SyncExecutor()));
        RedactionSession session = registry.getOrCreate("s-1");
        append(session, "Call John Smith");

        assertThat(coordinator.requestPass(session)).isEqualTo(SlowPassStatus.COALESCED);
        assertThat(session.isPassInFlight()).isFalse();
        assertThat(model.annotateCalls.get()).isZero();

        coordinator.tick();

        assertThat(model.annotateCalls.get()).isEqualTo(1);
        assertThat(session.withLock(() -> session.index().active())).hasSize(1);
        assertThat(meterRegistry.counter("phiredaction.slowlane.pass", "outcome", "deferred").count())
                .isEqualTo(1.0);
    }

    @Test
    void saturatedSlowLanePoolNeverRunsPassOnIngestThread() throws Exception {
        ThreadPoolProperties poolProps = new ThreadPoolProperties();
        poolProps.getSlowLane().setCorePoolSize(1);
        poolProps.getSlowLane().setMaxPoolSize(1);
        poolProps.getSlowLane().setQueueCapacity(0);
        ThreadPoolTaskExecutor slowPool = (ThreadPoolTaskExecutor) new ThreadPoolConfig(poolProps).slowLaneExecutor();
        ExecutorService detectorPool = Executors.newCachedThreadPool();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        model.behaviour = text -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return findJohnSmith(text);
        };
        try {
            SlowLaneCoordinator coordinator = coordinator(slowPool, new TaskExecutorAdapter(detectorPool));
            RedactionSession busy = registry.getOrCreate("s-1");
            append(busy, "Call John Smith");
            assertThat(coordinator.requestPass(busy)).isEqualTo(SlowPassStatus.ACCEPTED);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            RedactionSession waiting = registry.getOrCreate("s-2");
            append(waiting, "Please call John Smith back today");
            long startNanos = System.nanoTime();
            coordinator.onAppend(waiting);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            assertThat(elapsedMs).isLessThan(1_000);
            assertThat(waiting.isPassInFlight()).isFalse();
            assertThat(meterRegistry.counter("phiredaction.slowlane.pass", "outcome", "deferred").count())
                    .isEqualTo(1.0);

            release.countDown();
            waitUntil(() -> {
                coordinator.tick();
                return !waiting.withLock(() -> waiting.index().active()).isEmpty();
            });
            assertThat(waiting.withLock(() -> waiting.index().active()))
                    .extracting(Entity::text).containsExactly("John Smith");
        } finally {
            release.countDown();
            slowPool.shutdown();
            detectorPool.shutdownNow();
        }
    }
}
