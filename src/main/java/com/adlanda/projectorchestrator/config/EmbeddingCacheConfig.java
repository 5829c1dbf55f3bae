package com.adlanda.projectorchestrator.config;

import com.adlanda.projectorchestrator.repository.EmbeddingFileStore;
import com.adlanda.projectorchestrator.service.EmbeddingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two cache tiers from {@link WorkspaceProperties}.
 */
@Configuration
public class EmbeddingCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCacheConfig.class);

    @Bean
    public EmbeddingFileStore embeddingFileStore(WorkspaceProperties properties) {
        return new EmbeddingFileStore(properties.resolveEmbeddingCacheDir());
    }

    @Bean
    public EmbeddingCache embeddingCache(EmbeddingFileStore fileStore, WorkspaceProperties properties) {
        int maxEntries = properties.getEmbedding().getMaxMemoryEntries();
        log.info("Embedding cache: {} memory entries, disk tier at {}", maxEntries, fileStore.getDirectory());
        return new EmbeddingCache(fileStore, maxEntries);
    }
}
