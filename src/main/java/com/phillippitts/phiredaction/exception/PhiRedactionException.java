package com.phillippitts.phiredaction.exception;

/**
 * Base exception for all redaction-engine errors.
 * All domain exceptions extend this class to enable centralized error handling.
 *
 * <p>Messages must carry identifiers only (session, snapshot, entity, chunk ids), never transcript
 * text or entity text.
 */
public class PhiRedactionException extends RuntimeException {

    public PhiRedactionException(String message) {
        super(message);
    }

    public PhiRedactionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PhiRedactionException(Throwable cause) {
        super(cause);
    }
}
