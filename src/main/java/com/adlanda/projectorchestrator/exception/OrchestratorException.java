package com.adlanda.projectorchestrator.exception;

/**
 * Base class for the errors this service raises on purpose.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
