package com.memflow.memflow_backend.engine;

import com.memflow.memflow_backend.model.state.NodeStatus;

/**
 * Receives progress events of a workflow run. Every method defaults to a no-op.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {
    };

    default void workflowStarted(String executionId, String workflowId) {
    }

    default void nodeStarted(String executionId, String nodeId) {
    }

    default void nodeCompleted(String executionId, String nodeId, NodeStatus status) {
    }

    default void nodeError(String executionId, String nodeId, String error) {
    }

    /** A piece of output text, in emission order. */
    default void chunk(String executionId, String nodeId, String chunk) {
    }

    default void workflowCompleted(String executionId, WorkflowResult result) {
    }
}
