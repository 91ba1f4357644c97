package com.phillippitts.phiredaction.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RedactionMetricsTest {

    private SimpleMeterRegistry registry;
    private RedactionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RedactionMetrics(registry);
    }

    @Test
    void recordsDetectorLatencyPerDetector() {
        metrics.recordDetectorLatency("pattern", TimeUnit.MILLISECONDS.toNanos(4));
        metrics.recordDetectorLatency("pattern", TimeUnit.MILLISECONDS.toNanos(6));

        Timer timer = registry.find("phiredaction.detector.latency").tag("detector", "pattern").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(10.0);
    }

    @Test
    void countsDetectionsByLabel() {
        metrics.incrementDetections("pattern", "phone", 2);
        metrics.incrementDetections("pattern", "email", 1);

        assertThat(registry.counter("phiredaction.detections", "detector", "pattern", "label", "phone").count())
                .isEqualTo(2.0);
        assertThat(registry.counter("phiredaction.detections", "detector", "pattern", "label", "email").count())
                .isEqualTo(1.0);
    }

    @Test
    void zeroCountsRegisterNothing() {
        metrics.incrementDetections("pattern", "phone", 0);
        metrics.incrementMerge("added", 0);

        assertThat(registry.find("phiredaction.detections").counter()).isNull();
        assertThat(registry.find("phiredaction.merge").counter()).isNull();
    }

    @Test
    void countsOutcomesSeparately() {
        metrics.incrementSlowPass("success");
        metrics.incrementSlowPass("timeout");
        metrics.incrementSlowPass("timeout");
        metrics.incrementApply("stale");
        metrics.incrementEgress("blocked");
        metrics.incrementFastLaneTimeout();
        metrics.incrementUnmappedLabel("MISC");

        assertThat(registry.counter("phiredaction.slowlane.pass", "outcome", "success").count()).isEqualTo(1.0);
        assertThat(registry.counter("phiredaction.slowlane.pass", "outcome", "timeout").count()).isEqualTo(2.0);
        assertThat(registry.counter("phiredaction.apply", "outcome", "stale").count()).isEqualTo(1.0);
        assertThat(registry.counter("phiredaction.egress", "decision", "blocked").count()).isEqualTo(1.0);
        assertThat(registry.counter("phiredaction.fastlane.timeout").count()).isEqualTo(1.0);
        assertThat(registry.counter("phiredaction.slowlane.unmapped", "model_label", "MISC").count()).isEqualTo(1.0);
    }
}
