package com.adlanda.projectorchestrator.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for appending a message to the active conversation.
 */
public record MessageRequest(
        @NotBlank(message = "Role is required")
        String role,

        @NotBlank(message = "Content is required")
        String content
) {}
