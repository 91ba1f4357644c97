package com.phillippitts.phiredaction.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the asynchronous contextual slow lane and its cadence policy.
 *
 * <p>A pass is triggered when either {@code intervalMs} has elapsed since the last pass (and new
 * text exists) or more than {@code charThreshold} characters were appended since the last pass,
 * whichever comes first.
 */
@ConfigurationProperties(prefix = "phi.slow-lane")
@Validated
public class SlowLaneProperties {

    /** Disable to run every session in fast-lane-only (degraded) mode. */
    private boolean enabled = true;

    /** Wall-clock interval between passes, in milliseconds. */
    @Positive(message = "Interval must be positive")
    private long intervalMs = 5_000;

    /** Number of newly appended characters that triggers a pass. */
    @Positive(message = "Char threshold must be positive")
    private int charThreshold = 500;

    /** Time budget for one model call; exceeded passes are abandoned. */
    @Positive(message = "Pass timeout must be positive")
    private long passTimeoutMs = 3_000;

    /** Consecutive failed passes after which a session stays degraded. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 3;

    /** Scheduler tick used to evaluate the interval trigger, in milliseconds. */
    @Positive
    private long tickMs = 1_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public int getCharThreshold() {
        return charThreshold;
    }

    public void setCharThreshold(int charThreshold) {
        this.charThreshold = charThreshold;
    }

    public long getPassTimeoutMs() {
        return passTimeoutMs;
    }

    public void setPassTimeoutMs(long passTimeoutMs) {
        this.passTimeoutMs = passTimeoutMs;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getTickMs() {
        return tickMs;
    }

    public void setTickMs(long tickMs) {
        this.tickMs = tickMs;
    }
}
