package com.phillippitts.phiredaction.service.detect.fast;

import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.domain.Detection;
import com.phillippitts.phiredaction.domain.DetectionMethod;
import com.phillippitts.phiredaction.domain.EntityContext;
import com.phillippitts.phiredaction.service.detect.DetectorNames;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import com.phillippitts.phiredaction.util.LogSanitizer;
import com.phillippitts.phiredaction.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Fast lane: synchronous pattern scan of a single chunk.
 *
 * <p>The scan shares one wall-clock budget ({@code phi.fast-lane.scan-timeout-ms}) across all
 * rules. When the budget runs out the whole chunk yields no detections; the slow lane rescans the
 * buffer later, so an abandoned scan only delays detection.
 *
 * <p>Detections carry absolute buffer offsets: {@code baseOffset} is the offset at which the
 * chunk's first character was appended.
 */
@Component
public class PatternDetector {

    private static final Logger LOG = LogManager.getLogger(PatternDetector.class);

    private final FastLaneProperties props;
    private final RedactionMetrics metrics;

    public PatternDetector(FastLaneProperties props, RedactionMetrics metrics) {
        this.props = props;
        this.metrics = metrics;
    }

    /**
     * Scans one chunk.
     *
     * @param chunk appended chunk
     * @param baseOffset buffer offset of the chunk's first character
     * @return detections in buffer coordinates; empty if nothing matched or the deadline passed
     */
    public List<Detection> scan(Chunk chunk, int baseOffset) {
        String text = chunk.text();
        long startNanos = System.nanoTime();
        DeadlineCharSequence input = DeadlineCharSequence.withBudget(text, props.getScanTimeoutMs());
        List<Detection> out = new ArrayList<>();
        try {
            for (PhiPatterns.Rule rule : PhiPatterns.RULES) {
                Matcher m = rule.pattern().matcher(input);
                while (m.find()) {
                    int s = m.start(rule.group());
                    int e = m.end(rule.group());
                    if (s < 0 || e <= s) {
                        continue;
                    }
                    out.add(new Detection(rule.label(), text.substring(s, e), baseOffset + s, baseOffset + e,
                            rule.confidence(), DetectionMethod.PATTERN, List.of(contextOf(chunk, s, e))));
                }
            }
        } catch (DeadlineCharSequence.DeadlineExceededException timeout) {
            metrics.incrementFastLaneTimeout();
            LOG.warn("Pattern scan exceeded {} ms for chunk {} ({}); deferring to slow lane",
                    props.getScanTimeoutMs(), chunk.chunkId(), LogSanitizer.describe(text));
            return List.of();
        } finally {
            metrics.recordDetectorLatency(DetectorNames.PATTERN, TimeUtils.elapsedNanos(startNanos));
        }
        out.forEach(d -> metrics.incrementDetections(DetectorNames.PATTERN, d.label().wireName(), 1));
        LOG.debug("Pattern scan of chunk {} produced {} detections", chunk.chunkId(), out.size());
        return out;
    }

    private EntityContext contextOf(Chunk chunk, int start, int end) {
        String text = chunk.text();
        int window = props.getContextWindowChars();
        int from = Math.max(0, start - window);
        int to = Math.min(text.length(), end + window);
        return new EntityContext(chunk.chunkId(), text.substring(from, to), chunk.channel(), chunk.t0(), chunk.t1());
    }
}
