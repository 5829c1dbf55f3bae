package com.adlanda.projectorchestrator.exception;

import java.nio.file.Path;
import java.time.Duration;

/**
 * File discovery did not finish within its deadline. No partial result is available.
 */
public class DiscoveryTimeoutException extends OrchestratorException {

    private final Path root;
    private final Duration timeout;

    public DiscoveryTimeoutException(Path root, Duration timeout) {
        super("File discovery in " + root + " exceeded its timeout of " + timeout.toMillis() + " ms");
        this.root = root;
        this.timeout = timeout;
    }

    public Path getRoot() {
        return root;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
