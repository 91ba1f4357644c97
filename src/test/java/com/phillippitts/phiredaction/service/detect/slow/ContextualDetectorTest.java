package com.phillippitts.phiredaction.service.detect.slow;

import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.domain.DetectionMethod;
import com.phillippitts.phiredaction.domain.PhiLabel;
import com.phillippitts.phiredaction.exception.DetectorUnavailableException;
import com.phillippitts.phiredaction.service.buffer.ChunkBuffer;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.testutil.FakeContextModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.phiredaction.testutil.TestChunks.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextualDetectorTest {

    private ChunkBuffer buffer;
    private String text;
    private RedactionMetrics metrics;

    @BeforeEach
    void setUp() {
        buffer = new ChunkBuffer("s-1", " ");
        buffer.append(chunk("s-1", "c-1", "Call John", 0));
        buffer.append(chunk("s-1", "c-2", "Smith at home", 1));
        text = buffer.view().text();
        metrics = new RedactionMetrics(new SimpleMeterRegistry());
    }

    private ContextualDetector detectorFor(FakeContextModel model) {
        return new ContextualDetector(model, new LabelMapper(metrics), metrics, new FastLaneProperties());
    }

    @Test
    void mapsAnnotationsToDetectionsAcrossChunkBoundary() {
        FakeContextModel model = FakeContextModel.returning("fake", new ModelAnnotation("PER", 5, 15, 0.9));

        List<Detection> found = detectorFor(model).scanFull(text, buffer);

        assertThat(found).singleElement().satisfies(d -> {
            assertThat(d.label()).isEqualTo(PhiLabel.PERSON);
            assertThat(d.text()).isEqualTo("John Smith");
            assertThat(d.method()).isEqualTo(DetectionMethod.CONTEXTUAL);
            assertThat(d.contexts()).singleElement().satisfies(ctx -> assertThat(ctx.chunkId()).isEqualTo("c-1"));
        });
    }

    @Test
    void dropsUnmappedAndOutOfRangeAnnotations() {
        FakeContextModel model = FakeContextModel.returning("fake",
                new ModelAnnotation("MONEY", 0, 4, 0.9),
                new ModelAnnotation("PER", 10, 100, 0.9),
                new ModelAnnotation("PER", 8, 8, 0.9),
                new ModelAnnotation("GPE", 19, 23, 0.7));

        List<Detection> found = detectorFor(model).scanFull(text, buffer);

        assertThat(found).singleElement().satisfies(d -> {
            assertThat(d.label()).isEqualTo(PhiLabel.ADDRESS);
            assertThat(d.text()).isEqualTo("home");
            assertThat(d.contexts().get(0).chunkId()).isEqualTo("c-2");
        });
    }

    @Test
    void clampsScoresIntoUnitInterval() {
        FakeContextModel model = FakeContextModel.returning("fake", new ModelAnnotation("PER", 5, 9, 1.7));

        List<Detection> found = detectorFor(model).scanFull(text, buffer);

        assertThat(found.get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    void spanStartingOnSeparatorHasNoChunkId() {
        FakeContextModel model = FakeContextModel.returning("fake", new ModelAnnotation("PER", 9, 15, 0.9));

        List<Detection> found = detectorFor(model).scanFull(text, buffer);

        assertThat(found.get(0).contexts().get(0).chunkId()).isNull();
    }

    @Test
    void unhealthyModelIsUnavailable() {
        FakeContextModel model = new FakeContextModel("fake");
        model.healthy = false;

        assertThatThrownBy(() -> detectorFor(model).scanFull(text, buffer))
                .isInstanceOf(DetectorUnavailableException.class);
        assertThat(model.annotateCalls.get()).isZero();
    }

    @Test
    void wrapsModelCrashAsUnavailable() {
        FakeContextModel model = new FakeContextModel("fake");
        IllegalStateException crash = new IllegalStateException("native crash");
        model.failWith = crash;

        assertThatThrownBy(() -> detectorFor(model).scanFull(text, buffer))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasCause(crash);
    }
}
