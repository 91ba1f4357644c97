package com.phillippitts.phiredaction.config;

import com.phillippitts.phiredaction.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        Executor slowLane = config.slowLaneExecutor();
        AsyncTaskExecutor detector = config.detectorExecutor();

        assertThat(slowLane).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor slowLanePool = (ThreadPoolTaskExecutor) slowLane;
        assertThat(slowLanePool.getCorePoolSize()).isEqualTo(2);
        assertThat(slowLanePool.getMaxPoolSize()).isEqualTo(4);
        assertThat(slowLanePool.getThreadNamePrefix()).isEqualTo("slow-lane-");

        ThreadPoolTaskExecutor detectorPool = (ThreadPoolTaskExecutor) detector;
        assertThat(detectorPool.getCorePoolSize()).isEqualTo(2);
        assertThat(detectorPool.getMaxPoolSize()).isEqualTo(4);
        assertThat(detectorPool.getThreadNamePrefix()).isEqualTo("detector-");

        slowLanePool.shutdown();
        detectorPool.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).slowLaneExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        assertThat(executor.getActiveCount()).isLessThanOrEqualTo(executor.getMaxPoolSize());
        executor.shutdown();
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).slowLaneExecutor();
        ThreadContext.put("requestId", "req-1");
        ThreadContext.put("sessionId", "s-1");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seenSession = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seenSession.set(ThreadContext.get("sessionId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seenSession.get()).isEqualTo("s-1");
        assertThat(threadName.get()).startsWith("slow-lane-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("sessionId", "caller");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator()
                .decorate(() -> assertThat(ThreadContext.get("sessionId")).isEqualTo("caller"));

        ThreadContext.clearAll();
        ThreadContext.put("sessionId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isEqualTo("worker");
    }

    @Test
    void detectorFuturesCanBeCancelledWithInterrupt() throws Exception {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).detectorExecutor();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        Future<?> future = executor.submit(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
        });

        assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
        future.cancel(true);

        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
    }

    @Test
    void saturatedDetectorPoolRejects() throws InterruptedException {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getDetector().setCorePoolSize(1);
        props.getDetector().setMaxPoolSize(1);
        props.getDetector().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).detectorExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        executor.execute(blocker);
        executor.execute(blocker);

        assertThatThrownBy(() -> executor.execute(blocker))
                .isInstanceOf(RejectedExecutionException.class);
        release.countDown();
        executor.shutdown();
    }

    @Test
    void saturatedSlowLanePoolRejectsInsteadOfRunningOnCaller() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getSlowLane().setCorePoolSize(1);
        props.getSlowLane().setMaxPoolSize(1);
        props.getSlowLane().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).slowLaneExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();

        executor.execute(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        assertThatThrownBy(() -> executor.execute(() -> ranOn.set(Thread.currentThread().getName())))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(ranOn.get()).isNull();
        release.countDown();
        executor.shutdown();
    }

    @Test
    void shouldShutdownGracefully() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).slowLaneExecutor();

        executor.execute(() -> {
            // no-op
        });

        executor.shutdown();
        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }
}
