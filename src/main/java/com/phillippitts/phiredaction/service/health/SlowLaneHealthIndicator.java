package com.phillippitts.phiredaction.service.health;

import com.phillippitts.phiredaction.config.properties.SlowLaneProperties;
import com.phillippitts.phiredaction.service.detect.slow.ContextualDetector;
import com.phillippitts.phiredaction.service.detect.watchdog.DetectorWatchdog;
import com.phillippitts.phiredaction.service.session.RedactionSession;
import com.phillippitts.phiredaction.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the contextual slow lane.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: model available and no session persistently degraded</li>
 *   <li>DEGRADED: slow lane disabled by configuration, model recovering, or degraded sessions;
 *       ingestion and the fast lane keep working</li>
 *   <li>DOWN: model disabled by the watchdog after its restart budget was spent</li>
 * </ul>
 *
 * <p>Details carry the last failure of each degraded session and the model labels that had no
 * PHI category. Both hold identifiers and counts only.
 *
 * <p>Exposed via /actuator/health as {@code slowLane}.
 */
@Component
public class SlowLaneHealthIndicator implements HealthIndicator {

    public static final String DEGRADED = "DEGRADED";

    private final SlowLaneProperties props;
    private final DetectorWatchdog watchdog;
    private final ContextualDetector detector;
    private final SessionRegistry registry;

    public SlowLaneHealthIndicator(SlowLaneProperties props,
                                   DetectorWatchdog watchdog,
                                   ContextualDetector detector,
                                   SessionRegistry registry) {
        this.props = props;
        this.watchdog = watchdog;
        this.detector = detector;
        this.registry = registry;
    }

    @Override
    public Health health() {
        String model = detector.modelName();
        Map<String, String> degradedFailures = new TreeMap<>();
        long degradedSessions = 0;
        for (RedactionSession session : registry.all()) {
            if (session.isPersistentlyDegraded()) {
                degradedSessions++;
                degradedFailures.put(session.sessionId(),
                        session.lastFailure().map(Throwable::getMessage).orElse("unknown"));
            }
        }
        DetectorWatchdog.DetectorState state = watchdog.state();

        Health.Builder builder = new Health.Builder()
                .withDetail("model", model)
                .withDetail("modelState", state.name().toLowerCase(Locale.ROOT))
                .withDetail("activeSessions", registry.activeCount())
                .withDetail("degradedSessions", degradedSessions)
                .withDetail("unmappedLabels", detector.unmappedLabels());
        if (!degradedFailures.isEmpty()) {
            builder.withDetail("degradedSessionFailures", degradedFailures);
        }

        if (!props.isEnabled()) {
            return builder.status(DEGRADED).withDetail("status", "Slow lane disabled by configuration").build();
        }
        if (state == DetectorWatchdog.DetectorState.DISABLED) {
            return builder.down().withDetail("status", "Context model disabled after restart budget").build();
        }
        if (!watchdog.isAvailable()) {
            return builder.status(DEGRADED).withDetail("status", "Context model unavailable; fast lane only").build();
        }
        if (degradedSessions > 0) {
            return builder.status(DEGRADED).withDetail("status", "Some sessions persistently degraded").build();
        }
        return builder.up().withDetail("status", "Slow lane operational").build();
    }
}
