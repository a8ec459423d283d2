package com.memflow.memflow_backend.exception;

/**
 * An expression or template could not be evaluated: type mismatch, division
 * by zero, missing key. Subclasses cover undefined names and bad syntax.
 */
public class EvaluationException extends WorkflowException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
