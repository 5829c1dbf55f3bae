package com.adlanda.projectorchestrator.controller;

import com.adlanda.projectorchestrator.model.CacheStats;
import com.adlanda.projectorchestrator.service.EmbeddingCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the embedding cache.
 */
@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final EmbeddingCache cache;

    public CacheController(EmbeddingCache cache) {
        this.cache = cache;
    }

    @GetMapping
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(cache.stats());
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        cache.clear();
        return ResponseEntity.noContent().build();
    }
}
