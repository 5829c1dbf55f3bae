package com.adlanda.projectorchestrator.exception;

/**
 * Invalid input to a file operation (e.g. a scan root that is not a directory)
 * or an unrecoverable traversal failure.
 */
public class FileUtilityException extends OrchestratorException {

    public FileUtilityException(String message) {
        super(message);
    }

    public FileUtilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
