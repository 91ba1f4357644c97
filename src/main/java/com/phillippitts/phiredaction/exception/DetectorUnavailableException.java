package com.phillippitts.phiredaction.exception;

/**
 * Thrown when the contextual detector cannot run (model failed to load or crashed).
 * Sessions recover locally by falling back to fast-lane-only detection.
 */
public class DetectorUnavailableException extends PhiRedactionException {

    private final String detectorName;

    public DetectorUnavailableException(String message, String detectorName) {
        super(message + " (detector: " + detectorName + ")");
        this.detectorName = detectorName;
    }

    public DetectorUnavailableException(String message, String detectorName, Throwable cause) {
        super(message + " (detector: " + detectorName + ")", cause);
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
