package com.phillippitts.phiredaction.config;

import com.phillippitts.phiredaction.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by the slow lane.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and session count.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs slow-lane pass coordination: copy buffer text, await the model, merge.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Passes are requested from the
     * ingest path and the scheduler thread, neither of which may run a pass itself; a rejected
     * request is deferred to the next cadence tick.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext (requestId, sessionId) from the submitting
     * thread to the worker thread.
     *
     * @return configured executor for slow-lane passes
     */
    @Bean(name = "slowLaneExecutor")
    public Executor slowLaneExecutor() {
        return buildExecutor(threadPoolProperties.getSlowLane(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor that runs context-model calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated detector pool fails
     * the pass, which the coordinator records as a failure and retries on the next cadence tick.
     * Model calls are submitted as futures so that an abandoned pass can be interrupted.
     *
     * @return configured executor for model calls
     */
    @Bean(name = "detectorExecutor")
    public AsyncTaskExecutor detectorExecutor() {
        return buildExecutor(threadPoolProperties.getDetector(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                          RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
