package com.adlanda.projectorchestrator.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the query endpoint.
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1) @Max(20)
        Integer maxResults
) {
    public QueryRequest {
        if (maxResults == null) {
            maxResults = 5;
        }
    }
}
