package com.phillippitts.phiredaction;

import com.phillippitts.phiredaction.config.properties.ContextModelProperties;
import com.phillippitts.phiredaction.config.properties.DetectorWatchdogProperties;
import com.phillippitts.phiredaction.config.properties.FastLaneProperties;
import com.phillippitts.phiredaction.config.properties.PolicyProperties;
import com.phillippitts.phiredaction.config.properties.SessionProperties;
import com.phillippitts.phiredaction.config.properties.SlowLaneProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        FastLaneProperties.class,
        SlowLaneProperties.class,
        ContextModelProperties.class,
        DetectorWatchdogProperties.class,
        PolicyProperties.class,
        SessionProperties.class
})
@EnableScheduling
public class PhiRedactionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhiRedactionApplication.class, args);
    }

}
