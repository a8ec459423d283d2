package com.memflow.memflow_backend.exception;

/**
 * Illegal variable access: a write outside {@code conv.*}, a selector
 * without a key, or a read of a path that does not exist.
 */
public class SelectorException extends WorkflowException {

    public SelectorException(String message) {
        super(message);
    }
}
