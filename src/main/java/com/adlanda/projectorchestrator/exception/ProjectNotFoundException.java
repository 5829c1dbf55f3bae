package com.adlanda.projectorchestrator.exception;

public class ProjectNotFoundException extends OrchestratorException {

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
    }
}
