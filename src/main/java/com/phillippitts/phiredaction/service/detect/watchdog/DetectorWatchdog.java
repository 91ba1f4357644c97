package com.phillippitts.phiredaction.service.detect.watchdog;

import com.phillippitts.phiredaction.config.properties.DetectorWatchdogProperties;
import com.phillippitts.phiredaction.service.detect.slow.ContextModel;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Loads the context model at startup and restarts it after failures, within a budget.
 *
 * <p>The slow lane publishes {@link DetectorFailureEvent} when the model fails. Each failure
 * triggers a close-and-initialize restart as long as fewer than {@code max-restarts-per-window}
 * restarts happened in the last {@code window-minutes}. Past that budget the model is DISABLED.
 * It stays disabled until a failure event arrives after {@code cooldown-minutes}; the budget then
 * starts over.
 *
 * <p>While the model is unavailable every session runs fast-lane only and its snapshots are
 * marked degraded.
 */
@Component
public class DetectorWatchdog {

    private static final Logger LOG = LogManager.getLogger(DetectorWatchdog.class);

    public enum DetectorState { HEALTHY, DEGRADED, DISABLED }

    private final ContextModel model;
    private final DetectorWatchdogProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    // guarded by this
    private final Deque<Instant> restarts = new ArrayDeque<>();
    private Instant disabledUntil;

    private volatile DetectorState state = DetectorState.HEALTHY;

    public DetectorWatchdog(ContextModel model,
                            DetectorWatchdogProperties props,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.model = Objects.requireNonNull(model, "model");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads the model. A failure leaves the slow lane degraded instead of failing startup.
     */
    @PostConstruct
    public void loadModel() {
        try {
            model.initialize();
            state = DetectorState.HEALTHY;
            LOG.info("Context model {} loaded", model.getModelName());
        } catch (RuntimeException ex) {
            state = DetectorState.DEGRADED;
            LOG.error("Context model {} failed to load; slow lane degraded: {}", model.getModelName(), ex.toString());
        }
    }

    public String modelName() {
        return model.getModelName();
    }

    public DetectorState state() {
        return state;
    }

    /**
     * Returns whether slow-lane passes may be routed to the model.
     */
    public boolean isAvailable() {
        return state != DetectorState.DISABLED && model.isHealthy();
    }

    @EventListener
    public synchronized void onFailure(DetectorFailureEvent event) {
        if (!model.getModelName().equals(event.detector())) {
            LOG.warn("Ignoring failure event for unknown model {}", event.detector());
            return;
        }
        Instant now = clock.instant();
        LOG.warn("Context model {} failed: {}", event.detector(), event.message());

        if (state == DetectorState.DISABLED) {
            if (now.isBefore(disabledUntil)) {
                LOG.warn("Context model {} disabled until {}; no restart", event.detector(), disabledUntil);
                return;
            }
            restarts.clear();
            disabledUntil = null;
        }
        state = DetectorState.DEGRADED;

        Instant windowStart = now.minus(Duration.ofMinutes(props.getWindowMinutes()));
        restarts.removeIf(at -> at.isBefore(windowStart));
        if (restarts.size() >= props.getMaxRestartsPerWindow()) {
            state = DetectorState.DISABLED;
            disabledUntil = now.plus(Duration.ofMinutes(props.getCooldownMinutes()));
            LOG.error("Context model {} disabled after {} restarts within {}m; cooldown until {}",
                    event.detector(), restarts.size(), props.getWindowMinutes(), disabledUntil);
            return;
        }

        restarts.addLast(now);
        if (restart()) {
            publisher.publishEvent(new DetectorRecoveredEvent(event.detector(), now));
        } else {
            LOG.warn("Context model {} restart failed; slow lane stays degraded", event.detector());
        }
    }

    @EventListener
    public void onRecovered(DetectorRecoveredEvent event) {
        if (model.getModelName().equals(event.detector())) {
            state = DetectorState.HEALTHY;
            LOG.info("Context model {} recovered", event.detector());
        }
    }

    private boolean restart() {
        LOG.warn("Restarting context model {}", model.getModelName());
        try {
            model.close();
        } catch (RuntimeException ex) {
            LOG.debug("Ignoring error while closing context model: {}", ex.toString());
        }
        try {
            model.initialize();
            return true;
        } catch (RuntimeException ex) {
            LOG.error("Context model {} failed to initialize after restart: {}", model.getModelName(), ex.toString());
            return false;
        }
    }
}
