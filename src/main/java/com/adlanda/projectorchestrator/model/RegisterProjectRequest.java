package com.adlanda.projectorchestrator.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for project registration.
 */
public record RegisterProjectRequest(
        @NotBlank(message = "Name is required")
        String name,

        @NotBlank(message = "Source path is required")
        String sourcePath
) {}
