package com.phillippitts.phiredaction.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session lifecycle and buffer layout settings.
 */
@ConfigurationProperties(prefix = "phi.session")
@Validated
public class SessionProperties {

    /** Text inserted between consecutive chunks in the buffer. */
    @NotNull
    private String chunkSeparator = " ";

    /** Sessions without activity for this long are ended by the sweeper. */
    @Positive
    private int idleTimeoutMinutes = 120;

    public String getChunkSeparator() {
        return chunkSeparator;
    }

    public void setChunkSeparator(String chunkSeparator) {
        this.chunkSeparator = chunkSeparator;
    }

    public int getIdleTimeoutMinutes() {
        return idleTimeoutMinutes;
    }

    public void setIdleTimeoutMinutes(int idleTimeoutMinutes) {
        this.idleTimeoutMinutes = idleTimeoutMinutes;
    }
}
