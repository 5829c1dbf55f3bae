package com.adlanda.projectorchestrator.model;

import org.springframework.ai.document.Document;

/**
 * A single result from a query, containing the matched chunk and its similarity score.
 *
 * @param content     The text content of the matched chunk
 * @param sourceFile  Path to the source file
 * @param chunkIndex  Index of this chunk within the source file
 * @param score       Similarity score (higher is more similar)
 */
public record QueryResult(
        String content,
        String sourceFile,
        int chunkIndex,
        double score
) {
    public static QueryResult from(Document document) {
        Object sourceFile = document.getMetadata().getOrDefault(SourceChunk.SOURCE_FILE, "unknown");
        Object chunkIndex = document.getMetadata().getOrDefault(SourceChunk.CHUNK_INDEX, 0);
        Double score = document.getScore();
        return new QueryResult(
                document.getText(),
                String.valueOf(sourceFile),
                chunkIndex instanceof Number ? ((Number) chunkIndex).intValue() : 0,
                score != null ? score : 0.0
        );
    }
}
