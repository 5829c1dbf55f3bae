package com.adlanda.projectorchestrator.exception;

/**
 * Wraps a checked failure of an embedding computation. Unchecked failures are
 * propagated to callers as they were thrown.
 */
public class CacheComputeException extends OrchestratorException {

    public CacheComputeException(String message, Throwable cause) {
        super(message, cause);
    }
}
