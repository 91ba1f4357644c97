package com.phillippitts.phiredaction.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the redaction pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Detector latency per lane (pattern, contextual)</li>
 *   <li>Detections per lane and label</li>
 *   <li>Slow-pass outcomes and fast-lane scan timeouts</li>
 *   <li>Merge, apply and egress outcomes</li>
 * </ul>
 *
 * <p>Tags never carry transcript text. All metrics are exposed via Micrometer and available at
 * /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RedactionMetrics {

    private static final String METRIC_PREFIX = "phiredaction";

    private final MeterRegistry registry;

    public RedactionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records scan latency for a detector lane.
     *
     * @param detectorName name of the detector (pattern, contextual)
     * @param durationNanos duration in nanoseconds
     */
    public void recordDetectorLatency(String detectorName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".detector.latency")
                .description("Time taken by a detector scan")
                .tag("detector", detectorName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts detections produced by a lane.
     *
     * @param detectorName name of the detector
     * @param label wire name of the PHI label
     * @param count number of detections
     */
    public void incrementDetections(String detectorName, String label, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".detections")
                .description("Number of PHI detections by lane and label")
                .tag("detector", detectorName)
                .tag("label", label)
                .register(registry)
                .increment(count);
    }

    /**
     * Increments the counter of fast-lane scans abandoned at their deadline.
     */
    public void incrementFastLaneTimeout() {
        Counter.builder(METRIC_PREFIX + ".fastlane.timeout")
                .description("Number of pattern scans abandoned at their deadline")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a slow-lane pass.
     *
     * @param outcome success, timeout, unavailable, error or coalesced
     */
    public void incrementSlowPass(String outcome) {
        Counter.builder(METRIC_PREFIX + ".slowlane.pass")
                .description("Number of slow-lane passes by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts context-model labels that have no PHI mapping.
     *
     * @param modelLabel raw label emitted by the model
     */
    public void incrementUnmappedLabel(String modelLabel) {
        Counter.builder(METRIC_PREFIX + ".slowlane.unmapped")
                .description("Number of context-model annotations dropped for an unmapped label")
                .tag("model_label", modelLabel)
                .register(registry)
                .increment();
    }

    /**
     * Records merge outcomes.
     *
     * @param outcome added, superseded, duplicate or rejected
     * @param count number of detections with this outcome
     */
    public void incrementMerge(String outcome, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".merge")
                .description("Number of detections by merge outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment(count);
    }

    /**
     * Records an apply request outcome.
     *
     * @param outcome applied, stale or unknown_entity
     */
    public void incrementApply(String outcome) {
        Counter.builder(METRIC_PREFIX + ".apply")
                .description("Number of apply requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a policy-gate decision.
     *
     * @param decision redacted, passthrough or blocked
     */
    public void incrementEgress(String decision) {
        Counter.builder(METRIC_PREFIX + ".egress")
                .description("Number of egress requests by policy decision")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }
}
