package com.phillippitts.phiredaction.exception;

/**
 * Thrown when a slow-lane pass exceeds its time budget. The pass is abandoned and counted as a
 * failure; the next cadence tick tries again.
 */
public class DetectorTimeoutException extends PhiRedactionException {

    private final String detectorName;
    private final long timeoutMs;

    public DetectorTimeoutException(String message, String detectorName, long timeoutMs) {
        super(message + " (detector: " + detectorName + ")");
        this.detectorName = detectorName;
        this.timeoutMs = timeoutMs;
    }

    public DetectorTimeoutException(String message, String detectorName, long timeoutMs, Throwable cause) {
        super(message + " (detector: " + detectorName + ")", cause);
        this.detectorName = detectorName;
        this.timeoutMs = timeoutMs;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
