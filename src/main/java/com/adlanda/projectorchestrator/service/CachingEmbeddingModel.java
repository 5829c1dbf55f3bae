package com.adlanda.projectorchestrator.service;

import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingModel} that answers from the embedding cache.
 *
 * Per-request options are ignored: the cache key only covers the configured
 * backend identity and config version, so callers must not vary options
 * per request.
 */
class CachingEmbeddingModel implements EmbeddingModel {

    private final EmbeddingService embeddingService;

    CachingEmbeddingModel(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<String> inputs = request.getInstructions();
        List<Embedding> embeddings = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            embeddings.add(new Embedding(embeddingService.embed(inputs.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public float[] embed(String text) {
        return embeddingService.embed(text);
    }

    @Override
    public float[] embed(Document document) {
        return embeddingService.embed(document.getText());
    }

    @Override
    public int dimensions() {
        return embeddingService.backendDimensions();
    }
}
