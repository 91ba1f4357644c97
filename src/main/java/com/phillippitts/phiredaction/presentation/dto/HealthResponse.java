package com.phillippitts.phiredaction.presentation.dto;

/**
 * Body of {@code GET /redaction/health}.
 *
 * @param status            UP, or DEGRADED when the slow lane is not contributing
 * @param degraded          degraded-mode flag
 * @param slowLaneAvailable whether the context model can serve passes
 * @param offline           policy gate offline switch
 * @param redactBeforeSend  policy gate redaction switch
 * @param activeSessions    live sessions
 */
public record HealthResponse(
        String status,
        boolean degraded,
        boolean slowLaneAvailable,
        boolean offline,
        boolean redactBeforeSend,
        int activeSessions
) {}
