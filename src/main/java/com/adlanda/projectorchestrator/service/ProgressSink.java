package com.adlanda.projectorchestrator.service;

/**
 * Receives human-readable progress messages from long-running operations.
 *
 * Implementations may log, print or forward to a UI. Exceptions thrown by a
 * sink are logged by the caller and never abort the operation.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = message -> { };

    void onProgress(String message);
}
