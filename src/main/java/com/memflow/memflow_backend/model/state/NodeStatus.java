package com.memflow.memflow_backend.model.state;

public enum NodeStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    SKIPPED   // every incoming edge was not taken
}
