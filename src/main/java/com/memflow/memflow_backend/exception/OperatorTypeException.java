package com.memflow.memflow_backend.exception;

/**
 * An assignment operation does not fit the runtime type of its target or value.
 */
public class OperatorTypeException extends WorkflowException {

    public OperatorTypeException(String message) {
        super(message);
    }
}
