package com.adlanda.projectorchestrator.model;

/**
 * Summary of one indexing run over a project's source tree.
 *
 * @param projectId       Indexed project
 * @param filesDiscovered Source files found by discovery
 * @param filesIndexed    Files that produced at least one chunk
 * @param filesSkipped    Files skipped (unreadable, too large, empty)
 * @param chunksIndexed   Chunks written to the project's vector index
 * @param chunksRemoved   Chunks of earlier runs that this run no longer produced
 * @param deletedFiles    Files indexed before that are gone from the source tree
 * @param elapsedMs       Duration of the run
 */
public record IngestionSummary(
        String projectId,
        int filesDiscovered,
        int filesIndexed,
        int filesSkipped,
        int chunksIndexed,
        int chunksRemoved,
        int deletedFiles,
        long elapsedMs
) {}
