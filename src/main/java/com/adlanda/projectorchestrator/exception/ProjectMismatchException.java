package com.adlanda.projectorchestrator.exception;

/**
 * A resource manager was asked to act on a project other than the one it is switched to.
 */
public class ProjectMismatchException extends OrchestratorException {

    public ProjectMismatchException(String manager, String requested, String current) {
        super(manager + " is bound to project " + current + ", not " + requested);
    }
}
