package com.adlanda.projectorchestrator.exception;

/**
 * A registry request that cannot be honoured (invalid name, missing source tree,
 * removal of the active project).
 */
public class ProjectRegistryException extends OrchestratorException {

    public ProjectRegistryException(String message) {
        super(message);
    }
}
