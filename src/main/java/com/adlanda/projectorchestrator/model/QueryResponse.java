package com.adlanda.projectorchestrator.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param projectId    Project whose index answered the query
 * @param results      Matched chunks, ordered by relevance
 * @param totalChunks  Total number of chunks in the project's index
 * @param queryTimeMs  Time taken to process the query in milliseconds
 */
public record QueryResponse(
        String projectId,
        List<QueryResult> results,
        int totalChunks,
        long queryTimeMs
) {}
