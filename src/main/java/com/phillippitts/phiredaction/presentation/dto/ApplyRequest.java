package com.phillippitts.phiredaction.presentation.dto;

import java.util.List;

/**
 * Body of {@code POST /redaction/snapshots/{snapshotId}/apply}. A missing list means no entity
 * was accepted.
 */
public record ApplyRequest(List<String> acceptedEntityIds) {}
