package com.memflow.memflow_backend.model.state;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ExecutionMeta {
    private String workflowId;
    private String executionId;
    private String currentNodeId;
    private Instant startedAt;
    private Instant completedAt;
    private ExecutionStatus status;
    private String errorMessage;
}
