package com.memflow.memflow_backend.exception;

import lombok.Getter;

/**
 * Wraps the failure that aborted a run together with the id of the node that raised it.
 * The original typed error is kept as the cause.
 */
@Getter
public class NodeExecutionException extends WorkflowException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super("Node '" + nodeId + "' failed: " + message, cause);
        this.nodeId = nodeId;
    }
}
