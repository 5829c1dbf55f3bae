package com.adlanda.projectorchestrator.manager;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.model.SourceChunk;
import com.adlanda.projectorchestrator.service.EmbeddingService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Keeps the vector index of the active project open.
 *
 * Each project has its own index file {@code <vector-stores-dir>/<project-id>.json}
 * in Spring AI's {@link SimpleVectorStore} format. Embeddings go through the
 * embedding cache, so re-indexing unchanged text never calls the backend.
 */
@Component
public class VectorStoreManager extends AbstractResourceManager {

    public static final String NAME = "vector-store";

    private final Path storesDir;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;

    private SimpleVectorStore store;
    // document id -> source file, mirrors the ids held by the store
    private final Map<String, String> documentSources = new HashMap<>();
    private boolean dirty;

    @Autowired
    public VectorStoreManager(WorkspaceProperties properties, EmbeddingService embeddingService, ObjectMapper objectMapper) {
        this(properties.resolveVectorStoresDir(), embeddingService.asEmbeddingModel(), objectMapper);
    }

    VectorStoreManager(Path storesDir, EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
        this.storesDir = storesDir;
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public Path storeFile(String projectId) {
        requireValidId(projectId);
        return storesDir.resolve(projectId + ".json");
    }

    /**
     * Embeds and stores documents in the index of {@code projectId}, then saves the index.
     * Documents with an id already in the index replace the old version.
     *
     * @return the number of documents in the index afterwards
     * @throws com.adlanda.projectorchestrator.exception.ProjectMismatchException if another project is loaded
     */
    public int addDocuments(String projectId, List<Document> documents) {
        lock.writeLock().lock();
        try {
            requireCurrent(projectId);
            if (documents.isEmpty()) {
                return documentSources.size();
            }
            store.add(documents);
            documents.forEach(d -> documentSources.put(d.getId(), sourceOf(d)));
            dirty = true;
            try {
                persist(projectId);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save vector index of project " + projectId, e);
            }
            log.info("Stored {} documents for project {} ({} total)", documents.size(), projectId, documentSources.size());
            return documentSources.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes documents from the index of {@code projectId} and saves the index.
     * Ids that are not in the index are ignored.
     *
     * @return the number of documents removed
     */
    public int deleteDocuments(String projectId, Collection<String> ids) {
        lock.writeLock().lock();
        try {
            requireCurrent(projectId);
            List<String> present = new ArrayList<>();
            for (String id : ids) {
                if (documentSources.containsKey(id)) {
                    present.add(id);
                }
            }
            if (present.isEmpty()) {
                return 0;
            }
            store.delete(present);
            present.forEach(documentSources::remove);
            dirty = true;
            try {
                persist(projectId);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to save vector index of project " + projectId, e);
            }
            log.info("Removed {} documents from project {} ({} left)", present.size(), projectId, documentSources.size());
            return present.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Ids of the documents in the index of {@code projectId}, mapped to their source file.
     */
    public Map<String, String> documentSources(String projectId) {
        lock.readLock().lock();
        try {
            requireCurrent(projectId);
            return Map.copyOf(documentSources);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds the documents most similar to {@code query} in the index of {@code projectId}.
     *
     * @throws com.adlanda.projectorchestrator.exception.ProjectMismatchException if another project is loaded
     */
    public List<Document> search(String projectId, String query, int topK) {
        lock.readLock().lock();
        try {
            requireCurrent(projectId);
            if (documentSources.isEmpty()) {
                return List.of();
            }
            return store.similaritySearch(SearchRequest.builder()
                    .query(query)
                    .topK(topK)
                    .build());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of documents in the loaded index, 0 when nothing is loaded.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return store != null ? documentSources.size() : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected boolean activate(String projectId) {
        Path file = storeFile(projectId);
        SimpleVectorStore opened = SimpleVectorStore.builder(embeddingModel).build();
        Map<String, String> sources = new HashMap<>();

        if (Files.isRegularFile(file)) {
            try {
                JsonNode root = objectMapper.readTree(file.toFile());
                if (root == null || !root.isObject()) {
                    log.warn("Vector index {} is not a JSON object", file);
                    return false;
                }
                Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    sources.put(entry.getKey(), entry.getValue().path("metadata").path(SourceChunk.SOURCE_FILE).asText(""));
                }
                opened.load(file.toFile());
            } catch (IOException | RuntimeException e) {
                log.warn("Unreadable vector index {}: {}", file, e.getMessage());
                return false;
            }
            log.info("Opened vector index of project {} with {} documents", projectId, sources.size());
        } else {
            log.info("No vector index for project {} yet, starting empty", projectId);
        }

        store = opened;
        documentSources.clear();
        documentSources.putAll(sources);
        dirty = false;
        return true;
    }

    @Override
    protected void release(String projectId) throws IOException {
        try {
            if (dirty) {
                persist(projectId);
            }
        } finally {
            store = null;
            documentSources.clear();
            dirty = false;
        }
    }

    @Override
    protected Path artifactPath(String projectId) {
        return storeFile(projectId);
    }

    private static String sourceOf(Document document) {
        Object source = document.getMetadata().get(SourceChunk.SOURCE_FILE);
        return source != null ? source.toString() : "";
    }

    private void persist(String projectId) throws IOException {
        Path target = storeFile(projectId);
        Files.createDirectories(storesDir);
        Path temp = Files.createTempFile(storesDir, projectId, ".tmp");
        try {
            store.save(temp.toFile());
            moveIntoPlace(temp, target);
            dirty = false;
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
