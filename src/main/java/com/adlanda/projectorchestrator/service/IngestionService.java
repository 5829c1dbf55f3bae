package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.manager.VectorStoreManager;
import com.adlanda.projectorchestrator.model.DiscoveryResult;
import com.adlanda.projectorchestrator.model.FileDescriptor;
import com.adlanda.projectorchestrator.model.IngestionSummary;
import com.adlanda.projectorchestrator.model.ProjectRecord;
import com.adlanda.projectorchestrator.model.SourceChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Indexes the source tree of the active project into its vector store.
 *
 * Files come from {@link FileDiscoveryService}; each source file is split
 * into paragraph chunks, and chunk ids depend only on the file and the chunk
 * position, so re-indexing a project replaces its earlier chunks. Chunks the
 * run no longer produces (deleted files, shrunk files) are removed afterwards,
 * except those of files that could not be read this time.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final int BATCH_SIZE = 100;

    private final ProjectRegistryService registry;
    private final ProjectSwitchService switchService;
    private final FileDiscoveryService discoveryService;
    private final VectorStoreManager vectorStoreManager;
    private final FingerprintService fingerprintService;
    private final int maxTokens;
    private final long maxFileBytes;

    public IngestionService(ProjectRegistryService registry,
                            ProjectSwitchService switchService,
                            FileDiscoveryService discoveryService,
                            VectorStoreManager vectorStoreManager,
                            FingerprintService fingerprintService,
                            WorkspaceProperties properties) {
        this.registry = registry;
        this.switchService = switchService;
        this.discoveryService = discoveryService;
        this.vectorStoreManager = vectorStoreManager;
        this.fingerprintService = fingerprintService;
        this.maxTokens = properties.getIngestion().getMaxTokens();
        this.maxFileBytes = properties.getIngestion().getMaxFileBytes();
    }

    /**
     * Scans the project's source tree and upserts every chunk into its vector index.
     *
     * @param projectId Project to index; must be the active project
     * @param timeout   Limit for the discovery scan
     * @param sink      Progress receiver, may be null
     * @throws NoActiveProjectException if the project is not active or its vector store is not loaded
     */
    public IngestionSummary indexProject(String projectId, Duration timeout, ProgressSink sink) {
        ProjectRecord project = registry.require(projectId);
        if (!projectId.equals(switchService.currentProject().orElse(null))) {
            throw new NoActiveProjectException("Project " + projectId + " is not the active project");
        }
        if (!projectId.equals(vectorStoreManager.current().orElse(null))) {
            throw new NoActiveProjectException("Vector store of project " + projectId + " is not loaded");
        }
        ProgressSink progress = sink != null ? sink : ProgressSink.NONE;
        long startTime = System.currentTimeMillis();

        DiscoveryResult discovery = discoveryService.scan(Path.of(project.sourcePath()), timeout, progress);
        List<FileDescriptor> sources = discovery.sourceFiles();
        Map<String, String> previous = vectorStoreManager.documentSources(projectId);

        List<Document> batch = new ArrayList<>();
        Set<String> producedIds = new HashSet<>();
        Set<String> unreadable = new HashSet<>();
        int filesIndexed = 0;
        int filesSkipped = 0;
        int chunksIndexed = 0;

        for (FileDescriptor file : sources) {
            if (file.size() > maxFileBytes) {
                log.debug("Skipping {} ({} bytes)", file.relativePath(), file.size());
                filesSkipped++;
                continue;
            }
            List<SourceChunk> chunks;
            try {
                String content = readContent(file.path());
                chunks = chunkContent(content, file.relativePath(), fingerprintService.computeHash(content));
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", file.relativePath(), e.getMessage());
                unreadable.add(file.relativePath());
                filesSkipped++;
                continue;
            }
            if (chunks.isEmpty()) {
                filesSkipped++;
                continue;
            }

            for (SourceChunk chunk : chunks) {
                batch.add(chunk.toDocument());
                producedIds.add(chunk.id());
            }
            filesIndexed++;
            chunksIndexed += chunks.size();

            if (batch.size() >= BATCH_SIZE) {
                vectorStoreManager.addDocuments(projectId, List.copyOf(batch));
                batch.clear();
                report(progress, "Indexed " + filesIndexed + "/" + sources.size() + " files");
            }
        }
        if (!batch.isEmpty()) {
            vectorStoreManager.addDocuments(projectId, List.copyOf(batch));
        }

        Set<String> present = new HashSet<>();
        sources.forEach(f -> present.add(f.relativePath()));
        List<String> staleIds = new ArrayList<>();
        Set<String> deletedFiles = new HashSet<>();
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            String sourceFile = entry.getValue();
            if (producedIds.contains(entry.getKey()) || unreadable.contains(sourceFile)) {
                continue;
            }
            staleIds.add(entry.getKey());
            if (!present.contains(sourceFile)) {
                deletedFiles.add(sourceFile);
            }
        }
        int chunksRemoved = staleIds.isEmpty() ? 0 : vectorStoreManager.deleteDocuments(projectId, staleIds);

        registry.updateFileCount(projectId, filesIndexed);
        long elapsed = System.currentTimeMillis() - startTime;
        report(progress, "Indexed " + chunksIndexed + " chunks from " + filesIndexed + " files");
        log.info("Indexed project {}: {} files, {} chunks, {} skipped, {} stale chunks removed in {}ms",
                projectId, filesIndexed, chunksIndexed, filesSkipped, chunksRemoved, elapsed);

        return new IngestionSummary(projectId, sources.size(), filesIndexed, filesSkipped, chunksIndexed,
                chunksRemoved, deletedFiles.size(), elapsed);
    }

    /**
     * Splits content into chunks of about {@code maxTokens} tokens.
     *
     * Paragraphs (separated by blank lines) are packed together until the
     * next one would overflow the chunk. A single paragraph larger than a
     * chunk is cut on line boundaries.
     */
    List<SourceChunk> chunkContent(String content, String sourceFile, String fileHash) {
        List<SourceChunk> chunks = new ArrayList<>();
        // Rough token estimate: ~4 characters per token
        int maxChars = maxTokens * 4;

        StringBuilder currentChunk = new StringBuilder();
        for (String paragraph : content.split("\\r?\\n\\s*\\n")) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            for (String piece : splitOversized(trimmed, maxChars)) {
                if (currentChunk.length() > 0 && currentChunk.length() + piece.length() + 2 > maxChars) {
                    chunks.add(newChunk(currentChunk.toString(), sourceFile, chunks.size(), fileHash));
                    currentChunk = new StringBuilder();
                }
                if (currentChunk.length() > 0) {
                    currentChunk.append("\n\n");
                }
                currentChunk.append(piece);
            }
        }
        if (currentChunk.length() > 0) {
            chunks.add(newChunk(currentChunk.toString(), sourceFile, chunks.size(), fileHash));
        }
        return chunks;
    }

    private static List<String> splitOversized(String paragraph, int maxChars) {
        if (paragraph.length() <= maxChars) {
            return List.of(paragraph);
        }
        List<String> pieces = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        for (String line : paragraph.split("\\r?\\n")) {
            while (line.length() > maxChars) {
                if (piece.length() > 0) {
                    pieces.add(piece.toString());
                    piece = new StringBuilder();
                }
                pieces.add(line.substring(0, maxChars));
                line = line.substring(maxChars);
            }
            if (piece.length() > 0 && piece.length() + line.length() + 1 > maxChars) {
                pieces.add(piece.toString());
                piece = new StringBuilder();
            }
            if (piece.length() > 0) {
                piece.append('\n');
            }
            piece.append(line);
        }
        if (!piece.toString().isBlank()) {
            pieces.add(piece.toString());
        }
        return pieces;
    }

    private static SourceChunk newChunk(String text, String sourceFile, int index, String fileHash) {
        String id = UUID.nameUUIDFromBytes((sourceFile + "#" + index).getBytes(StandardCharsets.UTF_8)).toString();
        return new SourceChunk(id, text.strip(), sourceFile, index, fileHash);
    }

    /**
     * Reads a file as UTF-8, falling back to ISO-8859-1 for files in legacy encodings.
     */
    static String readContent(Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            return Files.readString(file, StandardCharsets.ISO_8859_1);
        }
    }

    private static void report(ProgressSink sink, String message) {
        try {
            sink.onProgress(message);
        } catch (RuntimeException e) {
            log.warn("Progress sink failed: {}", e.getMessage());
        }
    }
}
