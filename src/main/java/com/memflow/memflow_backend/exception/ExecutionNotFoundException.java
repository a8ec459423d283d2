package com.memflow.memflow_backend.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ExecutionNotFoundException extends RuntimeException {

    private final UUID executionId;

    public ExecutionNotFoundException(UUID executionId) {
        super("Execution not found: " + executionId);
        this.executionId = executionId;
    }
}
