package com.phillippitts.phiredaction.presentation.controller;

import com.phillippitts.phiredaction.domain.ApplyResult;
import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.presentation.dto.ApplyRequest;
import com.phillippitts.phiredaction.presentation.dto.ChunkRequest;
import com.phillippitts.phiredaction.presentation.dto.HealthResponse;
import com.phillippitts.phiredaction.presentation.dto.IngestResponse;
import com.phillippitts.phiredaction.presentation.dto.SlowPassResponse;
import com.phillippitts.phiredaction.presentation.dto.SnapshotResponse;
import com.phillippitts.phiredaction.service.RedactionService;
import com.phillippitts.phiredaction.service.policy.PolicyGate;
import com.phillippitts.phiredaction.service.slowlane.SlowPassStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Session-facing REST API: ingest, slow-pass trigger, snapshot, apply, end and health.
 */
@RestController
@RequestMapping("/redaction")
class RedactionController {

    private final RedactionService redactionService;
    private final PolicyGate policyGate;
    private final Clock clock;

    RedactionController(RedactionService redactionService, PolicyGate policyGate, Clock clock) {
        this.redactionService = redactionService;
        this.policyGate = policyGate;
        this.clock = clock;
    }

    @PostMapping("/sessions/{sessionId}/chunks")
    ResponseEntity<IngestResponse> ingest(@PathVariable String sessionId, @Valid @RequestBody ChunkRequest body) {
        Instant at = body.timestamp() != null ? body.timestamp() : clock.instant();
        Chunk chunk = new Chunk(body.chunkId(), sessionId, body.channel(), body.text(), body.t0(), body.t1(), at);
        return ResponseEntity.ok(IngestResponse.from(redactionService.ingest(chunk)));
    }

    @PostMapping("/sessions/{sessionId}/slow-pass")
    ResponseEntity<SlowPassResponse> slowPass(@PathVariable String sessionId) {
        SlowPassStatus status = redactionService.forceSlowPass(sessionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SlowPassResponse(sessionId, status));
    }

    @GetMapping("/sessions/{sessionId}/snapshot")
    ResponseEntity<SnapshotResponse> snapshot(@PathVariable String sessionId) {
        return ResponseEntity.ok(SnapshotResponse.from(redactionService.snapshot(sessionId)));
    }

    @PostMapping("/snapshots/{snapshotId}/apply")
    ResponseEntity<ApplyResult> apply(@PathVariable String snapshotId, @RequestBody(required = false) ApplyRequest body) {
        return ResponseEntity.ok(redactionService.apply(snapshotId, body == null ? null : body.acceptedEntityIds()));
    }

    @DeleteMapping("/sessions/{sessionId}")
    ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        redactionService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    ResponseEntity<HealthResponse> health() {
        boolean degraded = redactionService.isDegraded();
        return ResponseEntity.ok(new HealthResponse(
                degraded ? "DEGRADED" : "UP",
                degraded,
                redactionService.isSlowLaneAvailable(),
                policyGate.isOffline(),
                policyGate.isRedactBeforeSend(),
                redactionService.activeSessions()));
    }
}
