package com.memflow.memflow_backend.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class WorkflowNotFoundException extends RuntimeException {

    private final UUID workflowId;

    public WorkflowNotFoundException(UUID workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }
}
