package com.adlanda.projectorchestrator.model;

import java.time.Instant;

/**
 * An immutable embedding cache entry.
 *
 * The vector is copied on the way in and on the way out, so holders
 * can never mutate what other callers see.
 *
 * @param fingerprint Content fingerprint the entry is addressed by
 * @param createdAt   When the vector was computed
 * @param size        Size of the entry in bytes as stored on disk
 */
public record CacheEntry(String fingerprint, float[] vector, Instant createdAt, long size) {

    public CacheEntry {
        vector = vector.clone();
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimensions() {
        return vector.length;
    }
}
