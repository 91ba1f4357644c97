package com.phillippitts.phiredaction.service.policy;

import com.phillippitts.phiredaction.config.properties.PolicyProperties;
import com.phillippitts.phiredaction.domain.ApplyResult;
import com.phillippitts.phiredaction.domain.Snapshot;
import com.phillippitts.phiredaction.exception.EgressBlockedException;
import com.phillippitts.phiredaction.service.RedactionService;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * The single vetted channel through which transcript text leaves the engine.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>Offline mode: every release is refused with {@link EgressBlockedException}.</li>
 *   <li>Redact-before-send disabled: the snapshot's original text passes through unredacted.
 *       This switch belongs to the surrounding system; the release is logged at WARN.</li>
 *   <li>Otherwise: the text produced by the apply engine for the reviewer's decisions.</li>
 * </ol>
 *
 * <p>Audit log lines carry ids, counts and lengths only.
 */
@Component
public class PolicyGate {

    private static final Logger LOG = LogManager.getLogger(PolicyGate.class);

    private final PolicyProperties props;
    private final RedactionService redactionService;
    private final RedactionMetrics metrics;

    public PolicyGate(PolicyProperties props, RedactionService redactionService, RedactionMetrics metrics) {
        this.props = props;
        this.redactionService = redactionService;
        this.metrics = metrics;
    }

    /**
     * Releases text for a reviewed snapshot.
     *
     * @throws EgressBlockedException when offline mode is on
     */
    public ReleasedText release(EgressRequest request) {
        if (props.isOffline()) {
            metrics.incrementEgress("blocked");
            LOG.warn("Egress blocked (offline mode): snapshot={}, destination={}",
                    request.snapshotId(), request.destination());
            throw new EgressBlockedException("offline mode is enabled", request.destination());
        }

        if (!props.isRedactBeforeSend()) {
            Snapshot snapshot = redactionService.findSnapshot(request.snapshotId());
            metrics.incrementEgress("passthrough");
            LOG.warn("Egress passthrough WITHOUT redaction (redact-before-send=false): snapshot={}, "
                            + "destination={}, length={}",
                    snapshot.snapshotId(), request.destination(), snapshot.originalLength());
            return new ReleasedText(snapshot.snapshotId(), request.destination(), snapshot.originalText(),
                    false, 0, snapshot.entities().size());
        }

        ApplyResult applied = redactionService.apply(request.snapshotId(), request.acceptedEntityIds());
        metrics.incrementEgress("redacted");
        LOG.info("Egress released: snapshot={}, destination={}, accepted={}, rejected={}, length={}",
                applied.snapshotId(), request.destination(), applied.acceptedCount(), applied.rejectedCount(),
                applied.redactedLength());
        return new ReleasedText(applied.snapshotId(), request.destination(), applied.redactedText(), true,
                applied.acceptedCount(), applied.rejectedCount());
    }

    public boolean isOffline() {
        return props.isOffline();
    }

    public boolean isRedactBeforeSend() {
        return props.isRedactBeforeSend();
    }
}
