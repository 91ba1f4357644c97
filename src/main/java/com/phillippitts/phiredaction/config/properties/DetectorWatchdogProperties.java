package com.phillippitts.phiredaction.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the context-model watchdog.
 */
@ConfigurationProperties(prefix = "phi.watchdog")
@Validated
public class DetectorWatchdogProperties {

    /** Sliding window size for restart budget, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 60;

    /** Maximum model restarts permitted within the window. */
    @Positive(message = "Max restarts per window must be positive")
    private int maxRestartsPerWindow = 3;

    /** Cooldown minutes after disabling the model before a restart is attempted again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 10;

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxRestartsPerWindow() {
        return maxRestartsPerWindow;
    }

    public void setMaxRestartsPerWindow(int maxRestartsPerWindow) {
        this.maxRestartsPerWindow = maxRestartsPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }
}
