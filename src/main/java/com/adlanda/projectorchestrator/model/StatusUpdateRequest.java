package com.adlanda.projectorchestrator.model;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for a training status change.
 */
public record StatusUpdateRequest(
        @NotNull(message = "Status is required")
        TrainingStatus status
) {}
