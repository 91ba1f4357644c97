package com.phillippitts.phiredaction.service.detect.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a context model fails (load failure, crash, pass timeout).
 *
 * <p>PHI note: context holds identifiers and durations only, never transcript text.
 */
public record DetectorFailureEvent(
        String detector,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public DetectorFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
