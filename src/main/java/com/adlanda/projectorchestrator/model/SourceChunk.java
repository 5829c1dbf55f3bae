package com.adlanda.projectorchestrator.model;

import org.springframework.ai.document.Document;

import java.util.Map;

/**
 * A chunk of text cut from one source file of a project.
 *
 * @param id          Deterministic identifier (same file and position give the same id)
 * @param content     The text content of the chunk
 * @param sourceFile  Path of the source file, relative to the project root
 * @param chunkIndex  Index of this chunk within the source file
 * @param fileHash    SHA-256 hash of the source file (for change detection)
 */
public record SourceChunk(
        String id,
        String content,
        String sourceFile,
        int chunkIndex,
        String fileHash
) {
    public static final String SOURCE_FILE = "sourceFile";
    public static final String CHUNK_INDEX = "chunkIndex";
    public static final String FILE_HASH = "fileHash";

    /**
     * Converts this chunk to a Spring AI document for the vector store.
     */
    public Document toDocument() {
        Map<String, Object> metadata = Map.of(
                SOURCE_FILE, sourceFile,
                CHUNK_INDEX, chunkIndex,
                FILE_HASH, fileHash != null ? fileHash : ""
        );
        return new Document(id, content, metadata);
    }
}
