package com.phillippitts.phiredaction.config.detection;

import com.phillippitts.phiredaction.config.properties.ContextModelProperties;
import com.phillippitts.phiredaction.service.detect.slow.ContextModel;
import com.phillippitts.phiredaction.service.detect.slow.LexiconContextModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the context model and the clock shared by sessions, snapshots and cadence checks.
 *
 * <p>The model is not initialized here; {@code DetectorWatchdog} loads it at startup so a load
 * failure degrades the slow lane instead of failing the context.
 */
@Configuration
public class DetectionConfig {

    @Bean
    public ContextModel contextModel(ContextModelProperties props) {
        return new LexiconContextModel(props);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
