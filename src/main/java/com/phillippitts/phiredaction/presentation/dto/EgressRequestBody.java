package com.phillippitts.phiredaction.presentation.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record EgressRequestBody(
        @NotBlank String snapshotId,
        List<String> acceptedEntityIds,
        String destination
) {}
