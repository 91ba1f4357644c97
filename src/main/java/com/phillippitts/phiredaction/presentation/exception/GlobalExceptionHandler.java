package com.phillippitts.phiredaction.presentation.exception;

import com.phillippitts.phiredaction.exception.ChunkValidationException;
import com.phillippitts.phiredaction.exception.DetectorTimeoutException;
import com.phillippitts.phiredaction.exception.DetectorUnavailableException;
import com.phillippitts.phiredaction.exception.EgressBlockedException;
import com.phillippitts.phiredaction.exception.SessionNotFoundException;
import com.phillippitts.phiredaction.exception.SnapshotNotFoundException;
import com.phillippitts.phiredaction.exception.StaleSnapshotException;
import com.phillippitts.phiredaction.exception.UnknownEntityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Exception messages in this application carry ids, counts and offsets only, so they may be
 * returned to clients; request bodies are never echoed.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed or out-of-order chunk (HTTP 400).
     */
    @ExceptionHandler(ChunkValidationException.class)
    ResponseEntity<ApiError> handleChunkValidation(ChunkValidationException ex) {
        LOG.warn("Invalid chunk: session={}, chunk={}, reason={}", ex.getSessionId(), ex.getChunkId(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid chunk", ex.getMessage());
    }

    /**
     * Client error - apply referenced ids outside the snapshot (HTTP 400). No text is produced.
     */
    @ExceptionHandler(UnknownEntityException.class)
    ResponseEntity<ApiError> handleUnknownEntity(UnknownEntityException ex) {
        LOG.warn("Unknown entity ids: snapshot={}, count={}", ex.getSnapshotId(), ex.getUnknownIds().size());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Unknown entity ids", ex.getMessage());
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOG.warn("Invalid request body: {}", fields);
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request body", fields);
    }

    /**
     * Client error - unparseable body (HTTP 400). The parser message may quote the payload, so it
     * is neither logged nor returned.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body");
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Malformed request body",
                "Body must be valid JSON matching the endpoint contract");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Session not found", ex.getMessage());
    }

    @ExceptionHandler(SnapshotNotFoundException.class)
    ResponseEntity<ApiError> handleSnapshotNotFound(SnapshotNotFoundException ex) {
        LOG.info("Snapshot not found: {}", ex.getSnapshotId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Snapshot not found", ex.getMessage());
    }

    /**
     * Conflict - snapshot no longer matches the buffer (HTTP 409). Build a new snapshot.
     */
    @ExceptionHandler(StaleSnapshotException.class)
    ResponseEntity<ApiError> handleStale(StaleSnapshotException ex) {
        LOG.warn("Stale snapshot: snapshot={}, session={}, entity={}",
                ex.getSnapshotId(), ex.getSessionId(), ex.getEntityId());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), "Snapshot is stale",
                "Request a new snapshot and review again");
    }

    /**
     * Policy refusal (HTTP 403).
     */
    @ExceptionHandler(EgressBlockedException.class)
    ResponseEntity<ApiError> handleEgressBlocked(EgressBlockedException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getClass().getSimpleName(), "Egress blocked", ex.getReason());
    }

    /**
     * Detector failures are normally recovered inside the slow lane; reaching the boundary means
     * the caller asked for something that needs the model (HTTP 503).
     */
    @ExceptionHandler({DetectorUnavailableException.class, DetectorTimeoutException.class})
    ResponseEntity<ApiError> handleDetector(RuntimeException ex) {
        LOG.error("Detector failure surfaced to client: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Contextual detector temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // routing errors raised by Spring MVC itself (unknown path, wrong method)
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return error(status, ex.getClass().getSimpleName(), status.getReasonPhrase(), "Check method and path");
        }
        LOG.error("Unexpected error: {}", ex.getClass().getName());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
