package com.phillippitts.phiredaction.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the synchronous pattern-based fast lane.
 */
@ConfigurationProperties(prefix = "phi.fast-lane")
@Validated
public class FastLaneProperties {

    /** Wall-clock budget for scanning one chunk; on expiry the scan yields no findings. */
    @Positive(message = "Scan timeout must be positive")
    private long scanTimeoutMs = 50;

    /** Longest chunk accepted by ingest, in characters. */
    @Positive(message = "Max chunk chars must be positive")
    private int maxChunkChars = 20_000;

    /** Characters of surrounding text captured on each side of a finding. */
    @PositiveOrZero
    private int contextWindowChars = 40;

    public long getScanTimeoutMs() {
        return scanTimeoutMs;
    }

    public void setScanTimeoutMs(long scanTimeoutMs) {
        this.scanTimeoutMs = scanTimeoutMs;
    }

    public int getMaxChunkChars() {
        return maxChunkChars;
    }

    public void setMaxChunkChars(int maxChunkChars) {
        this.maxChunkChars = maxChunkChars;
    }

    public int getContextWindowChars() {
        return contextWindowChars;
    }

    public void setContextWindowChars(int contextWindowChars) {
        this.contextWindowChars = contextWindowChars;
    }
}
