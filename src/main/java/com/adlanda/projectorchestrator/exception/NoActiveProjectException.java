package com.adlanda.projectorchestrator.exception;

public class NoActiveProjectException extends OrchestratorException {

    public NoActiveProjectException(String message) {
        super(message);
    }
}
