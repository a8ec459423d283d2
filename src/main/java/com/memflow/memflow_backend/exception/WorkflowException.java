package com.memflow.memflow_backend.exception;

/**
 * Base type for every failure raised by the workflow interpreter.
 * Subclasses identify the error category so callers can tell configuration
 * bugs from evaluation or typing problems without parsing messages.
 */
public abstract class WorkflowException extends RuntimeException {

    protected WorkflowException(String message) {
        super(message);
    }

    protected WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
