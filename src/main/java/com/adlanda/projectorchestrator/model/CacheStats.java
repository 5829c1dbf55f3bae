package com.adlanda.projectorchestrator.model;

/**
 * Embedding cache counters.
 *
 * @param memoryEntries Entries currently held in memory
 * @param diskEntries   Entries currently persisted on disk
 * @param memoryHits    Lookups answered from memory since start
 * @param diskHits      Lookups answered from disk since start
 * @param computations  Calls made to the compute function since start
 */
public record CacheStats(
        int memoryEntries,
        long diskEntries,
        long memoryHits,
        long diskHits,
        long computations
) {}
