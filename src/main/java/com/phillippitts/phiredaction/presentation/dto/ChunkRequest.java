package com.phillippitts.phiredaction.presentation.dto;

import com.phillippitts.phiredaction.domain.Channel;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Body of {@code POST /redaction/sessions/{sessionId}/chunks}.
 *
 * @param chunkId   optional client id; generated when absent
 * @param channel   capture channel
 * @param text      transcript text
 * @param t0        audio start, seconds
 * @param t1        audio end, seconds
 * @param timestamp ingest timestamp; the server clock is used when absent
 */
public record ChunkRequest(
        String chunkId,
        @NotNull Channel channel,
        @NotNull String text,
        double t0,
        double t1,
        Instant timestamp
) {}
