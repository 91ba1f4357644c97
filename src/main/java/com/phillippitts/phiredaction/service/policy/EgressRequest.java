package com.phillippitts.phiredaction.service.policy;

import java.util.List;
import java.util.Objects;

/**
 * Request to release text to an outbound destination.
 *
 * <p>Carries a snapshot reference and the reviewer's decisions only; raw text is never accepted.
 *
 * @param snapshotId         reviewed snapshot
 * @param acceptedEntityIds  entities to redact
 * @param destination        logical name of the outbound consumer (for audit)
 */
public record EgressRequest(String snapshotId, List<String> acceptedEntityIds, String destination) {

    public EgressRequest {
        Objects.requireNonNull(snapshotId, "snapshotId");
        acceptedEntityIds = acceptedEntityIds == null ? List.of() : List.copyOf(acceptedEntityIds);
        destination = destination == null || destination.isBlank() ? "unspecified" : destination;
    }
}
