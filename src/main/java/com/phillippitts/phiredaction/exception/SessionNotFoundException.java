package com.phillippitts.phiredaction.exception;

/**
 * Thrown when an operation references a session that was never created or has been ended.
 */
public class SessionNotFoundException extends PhiRedactionException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
