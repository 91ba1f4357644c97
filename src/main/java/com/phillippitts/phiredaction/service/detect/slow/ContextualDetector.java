package com.phillippitts.phiredaction.service.detect.slow;

import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.domain.DetectionMethod;
import com.phillippitts.phiredaction.domain.EntityContext;
import com.phillippitts.phiredaction.domain.PhiLabel;
import com.phillippitts.phiredaction.exception.DetectorExceptionBuilder;
import com.phillippitts.phiredaction.exception.DetectorUnavailableException;
import com.phillippitts.phiredaction.service.buffer.ChunkBuffer;
import com.phillippitts.phiredaction.service.detect.DetectorNames;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Slow lane: runs the {@link ContextModel} over a whole buffer and turns its annotations into
 * detections.
 *
 * <p>Annotations with out-of-range offsets are dropped. Provenance is taken from the chunk that
 * contains the first character of the span; spans that start on a separator have no chunk id.
 */
@Component
public class ContextualDetector {

    private static final Logger LOG = LogManager.getLogger(ContextualDetector.class);

    private final ContextModel model;
    private final LabelMapper mapper;
    private final RedactionMetrics metrics;
    private final int contextWindow;

    public ContextualDetector(ContextModel model, LabelMapper mapper, RedactionMetrics metrics,
                              FastLaneProperties fastLaneProperties) {
        this.model = model;
        this.mapper = mapper;
        this.metrics = metrics;
        this.contextWindow = fastLaneProperties.getContextWindowChars();
    }

    /**
     * Scans the full buffer text.
     *
     * @param text buffer text copied at a known version
     * @param buffer source buffer, used only to resolve chunk provenance
     * @return detections in buffer coordinates
     * @throws DetectorUnavailableException if the model is unhealthy or fails
     */
    public List<Detection> scanFull(String text, ChunkBuffer buffer) {
        if (!model.isHealthy()) {
            throw DetectorExceptionBuilder.create("Context model is not available")
                    .detector(model.getModelName())
                    .buildUnavailable();
        }
        long startNanos = System.nanoTime();
        List<ModelAnnotation> annotations;
        try {
            annotations = model.annotate(text);
        } catch (DetectorUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DetectorExceptionBuilder.create("Context model failed")
                    .detector(model.getModelName())
                    .cause(e)
                    .metadata("textLength", text.length())
                    .buildUnavailable();
        } finally {
            metrics.recordDetectorLatency(DetectorNames.CONTEXTUAL, TimeUtils.elapsedNanos(startNanos));
        }

        List<Detection> out = new ArrayList<>();
        for (ModelAnnotation a : annotations) {
            if (a.start() < 0 || a.end() > text.length() || a.end() <= a.start()) {
                LOG.debug("Dropping out-of-range annotation [{},{}) for text length {}",
                        a.start(), a.end(), text.length());
                continue;
            }
            Optional<PhiLabel> label = mapper.map(a.label());
            if (label.isEmpty()) {
                continue;
            }
            double confidence = Math.max(0.0, Math.min(1.0, a.score()));
            out.add(new Detection(label.get(), text.substring(a.start(), a.end()), a.start(), a.end(),
                    confidence, DetectionMethod.CONTEXTUAL, List.of(contextOf(text, buffer, a.start(), a.end()))));
            metrics.incrementDetections(DetectorNames.CONTEXTUAL, label.get().wireName(), 1);
        }
        return out;
    }

    public String modelName() {
        return model.getModelName();
    }

    /**
     * Model labels seen so far that have no PHI category, with their counts.
     */
    public Map<String, Long> unmappedLabels() {
        return mapper.unmappedCounts();
    }

    private EntityContext contextOf(String text, ChunkBuffer buffer, int start, int end) {
        String surrounding = text.substring(Math.max(0, start - contextWindow),
                Math.min(text.length(), end + contextWindow));
        Optional<ChunkBuffer.ChunkSpan> span = buffer.chunkAt(start);
        if (span.isEmpty()) {
            return new EntityContext(null, surrounding, null, 0.0, 0.0);
        }
        Chunk chunk = span.get().chunk();
        return new EntityContext(chunk.chunkId(), surrounding, chunk.channel(), chunk.t0(), chunk.t1());
    }
}
