package com.memflow.memflow_backend.model.state;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILURE
}
