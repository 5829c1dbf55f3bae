package com.adlanda.projectorchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Every call goes through the {@link EmbeddingCache}: the backend
 * (Spring AI's EmbeddingModel) is only asked for texts whose fingerprint
 * has never been embedded with the current backend configuration.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingCache cache;
    private final FingerprintService fingerprintService;
    private final CachingEmbeddingModel cachingModel;

    public EmbeddingService(EmbeddingModel embeddingModel, EmbeddingCache cache, FingerprintService fingerprintService) {
        this.embeddingModel = embeddingModel;
        this.cache = cache;
        this.fingerprintService = fingerprintService;
        this.cachingModel = new CachingEmbeddingModel(this);
    }

    /**
     * Generates (or recalls) the embedding vector for the given text.
     *
     * @param text The text to embed
     * @return the embedding vector
     */
    public float[] embed(String text) {
        String fingerprint = fingerprintService.fingerprint(text);
        return cache.getOrCompute(fingerprint, fp -> {
            log.debug("Embedding cache miss for {}, calling backend", fp.substring(0, 12));
            return embeddingModel.embed(text);
        });
    }

    /**
     * Embeds several texts, one cache lookup each.
     */
    public List<float[]> embedAll(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    /**
     * A Spring AI {@link EmbeddingModel} view of this service, for components
     * (such as vector stores) that call the model themselves.
     */
    public EmbeddingModel asEmbeddingModel() {
        return cachingModel;
    }

    int backendDimensions() {
        return embeddingModel.dimensions();
    }
}
