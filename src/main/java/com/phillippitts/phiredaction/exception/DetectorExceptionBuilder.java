package com.phillippitts.phiredaction.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for detector exceptions carrying reproducible context.
 *
 * <p>Only identifiers and technical diagnostics may be attached. Never pass transcript or
 * entity text as metadata.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw DetectorExceptionBuilder.create("Slow-lane pass timed out")
 *         .detector("contextual")
 *         .session(sessionId)
 *         .durationMs(3000)
 *         .metadata("bufferVersion", version)
 *         .buildTimeout(3000);
 *
 * throw DetectorExceptionBuilder.create("Lexicon failed to load")
 *         .detector("contextual")
 *         .cause(ioException)
 *         .metadata("resource", lexiconPath)
 *         .buildUnavailable();
 * </pre>
 */
public final class DetectorExceptionBuilder {

    private final String message;
    private String detectorName;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DetectorExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static DetectorExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DetectorExceptionBuilder(message);
    }

    public DetectorExceptionBuilder detector(String detectorName) {
        this.detectorName = detectorName;
        return this;
    }

    public DetectorExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public DetectorExceptionBuilder session(String sessionId) {
        return metadata("session", sessionId);
    }

    public DetectorExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value (identifiers and numbers only)
     * @return this builder for chaining
     */
    public DetectorExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public DetectorUnavailableException buildUnavailable() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new DetectorUnavailableException(detailed, detectorOrUnknown(), cause)
                : new DetectorUnavailableException(detailed, detectorOrUnknown());
    }

    public DetectorTimeoutException buildTimeout(long timeoutMs) {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new DetectorTimeoutException(detailed, detectorOrUnknown(), timeoutMs, cause)
                : new DetectorTimeoutException(detailed, detectorOrUnknown(), timeoutMs);
    }

    private String detectorOrUnknown() {
        return detectorName != null ? detectorName : "unknown";
    }

    /**
     * Final message format: {@code {message} (durationMs={ms}, {key1}={val1}, ...)}.
     */
    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
