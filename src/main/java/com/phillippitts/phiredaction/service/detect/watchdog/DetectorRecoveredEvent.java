package com.phillippitts.phiredaction.service.detect.watchdog;

import java.time.Instant;

/**
 * Published when a context model has been successfully restarted after failures.
 */
public record DetectorRecoveredEvent(
        String detector,
        Instant at
) {
    public DetectorRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
