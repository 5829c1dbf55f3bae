package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.exception.CacheComputeException;
import com.adlanda.projectorchestrator.model.CacheEntry;
import com.adlanda.projectorchestrator.model.CacheStats;
import com.adlanda.projectorchestrator.repository.EmbeddingFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Content-addressed embedding cache with a bounded in-memory tier in front of
 * an {@link EmbeddingFileStore}.
 *
 * Lookup order is memory, then disk, then the compute function. A disk hit is
 * promoted into memory. Concurrent requests for the same fingerprint share one
 * in-flight computation; requests for different fingerprints never wait on
 * each other. A failed computation leaves nothing behind, so the next call
 * for that fingerprint computes again.
 */
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    private final EmbeddingFileStore diskStore;
    private final int maxMemoryEntries;
    private final Map<String, CacheEntry> memory;
    private final ConcurrentMap<String, CompletableFuture<float[]>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong diskHits = new AtomicLong();
    private final AtomicLong computations = new AtomicLong();

    public EmbeddingCache(EmbeddingFileStore diskStore, int maxMemoryEntries) {
        if (maxMemoryEntries < 1) {
            throw new IllegalArgumentException("maxMemoryEntries must be positive: " + maxMemoryEntries);
        }
        this.diskStore = diskStore;
        this.maxMemoryEntries = maxMemoryEntries;
        this.memory = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > EmbeddingCache.this.maxMemoryEntries;
            }
        };
    }

    /**
     * Returns the vector for a fingerprint, computing it at most once per process.
     *
     * @param fingerprint Content fingerprint (hex)
     * @param computeFn   Produces the vector on a miss; its exceptions reach the caller
     * @return a copy of the cached vector
     */
    public float[] getOrCompute(String fingerprint, Function<String, float[]> computeFn) {
        CacheEntry cached = memoryGet(fingerprint);
        if (cached != null) {
            memoryHits.incrementAndGet();
            return cached.vector();
        }

        CompletableFuture<float[]> flight = new CompletableFuture<>();
        CompletableFuture<float[]> existing = inFlight.putIfAbsent(fingerprint, flight);
        if (existing != null) {
            log.debug("Waiting for in-flight computation of {}", shortId(fingerprint));
            return await(fingerprint, existing).clone();
        }

        try {
            float[] vector = lookupOrCompute(fingerprint, computeFn);
            flight.complete(vector);
            return vector.clone();
        } catch (RuntimeException | Error e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, flight);
        }
    }

    /**
     * Returns the entry if it is already cached in either tier, without computing.
     */
    public Optional<CacheEntry> peek(String fingerprint) {
        CacheEntry cached = memoryGet(fingerprint);
        if (cached != null) {
            return Optional.of(cached);
        }
        return diskStore.read(fingerprint);
    }

    public CacheStats stats() {
        int memoryEntries;
        synchronized (memory) {
            memoryEntries = memory.size();
        }
        return new CacheStats(
                memoryEntries,
                diskStore.count(),
                memoryHits.get(),
                diskHits.get(),
                computations.get()
        );
    }

    /**
     * Drops every entry from both tiers. In-flight computations still complete
     * and are cached afterwards.
     */
    public void clear() {
        synchronized (memory) {
            memory.clear();
        }
        try {
            diskStore.clear();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear embedding cache in " + diskStore.getDirectory(), e);
        }
        log.info("Embedding cache cleared");
    }

    private float[] lookupOrCompute(String fingerprint, Function<String, float[]> computeFn) {
        // Another flight may have finished between the memory check and winning this one.
        CacheEntry cached = memoryGet(fingerprint);
        if (cached != null) {
            memoryHits.incrementAndGet();
            return cached.vector();
        }

        Optional<CacheEntry> onDisk = diskStore.read(fingerprint);
        if (onDisk.isPresent()) {
            diskHits.incrementAndGet();
            memoryPut(onDisk.get());
            return onDisk.get().vector();
        }

        computations.incrementAndGet();
        float[] vector = computeFn.apply(fingerprint);
        if (vector == null || vector.length == 0) {
            throw new IllegalStateException("Embedding computation returned no vector for " + shortId(fingerprint));
        }

        Instant now = Instant.now();
        try {
            diskStore.write(fingerprint, vector, now);
        } catch (IOException e) {
            log.warn("Could not persist embedding {}: {}", shortId(fingerprint), e.getMessage());
        }
        CacheEntry entry = new CacheEntry(fingerprint, vector, now, (long) vector.length * Float.BYTES);
        memoryPut(entry);
        return entry.vector();
    }

    private float[] await(String fingerprint, CompletableFuture<float[]> flight) {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheComputeException("Interrupted while waiting for embedding " + shortId(fingerprint), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CacheComputeException("Embedding computation failed for " + shortId(fingerprint), cause);
        }
    }

    private CacheEntry memoryGet(String fingerprint) {
        synchronized (memory) {
            return memory.get(fingerprint);
        }
    }

    private void memoryPut(CacheEntry entry) {
        synchronized (memory) {
            memory.putIfAbsent(entry.fingerprint(), entry);
        }
    }

    private static String shortId(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
