package com.phillippitts.phiredaction.exception;

/**
 * Thrown by the policy gate when text is not allowed to leave the process.
 */
public class EgressBlockedException extends PhiRedactionException {

    private final String reason;
    private final String destination;

    public EgressBlockedException(String reason, String destination) {
        super("Egress blocked: " + reason + " (destination=" + destination + ")");
        this.reason = reason;
        this.destination = destination;
    }

    public String getReason() {
        return reason;
    }

    public String getDestination() {
        return destination;
    }
}
