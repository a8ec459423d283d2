package com.memflow.memflow_backend.model.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context of one workflow run, shared by reference across every node of that run.
 * Only the node currently executing touches it.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowState {

    public static final String SYS = "sys";
    public static final String CONV = "conv";

    private ExecutionMeta meta;

    /** Holds the two variable namespaces: {@code sys} (read-only) and {@code conv} (mutable). */
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    /** Last output of each executed node, keyed by node id. */
    @Builder.Default
    private Map<String, Object> runtimeVars = new LinkedHashMap<>();

    /** Audit record per executed node. */
    @Builder.Default
    private Map<String, NodeResult> nodeResults = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, StreamingBuffer> streamingBuffer = new LinkedHashMap<>();

    @Builder.Default
    private List<ToolError> errors = new ArrayList<>();

    @Builder.Default
    private List<String> nodeExecutionOrder = new ArrayList<>();

    // Set when a node failed and the run continued along its error edge
    private String error;
    private String errorNode;

    public static WorkflowState create(String workflowId, String executionId,
                                       Map<String, Object> systemVars,
                                       Map<String, Object> conversationVars) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put(SYS, systemVars != null ? new LinkedHashMap<>(systemVars) : new LinkedHashMap<>());
        variables.put(CONV, conversationVars != null ? new LinkedHashMap<>(conversationVars) : new LinkedHashMap<>());
        return WorkflowState.builder()
                .meta(ExecutionMeta.builder()
                        .workflowId(workflowId)
                        .executionId(executionId)
                        .startedAt(Instant.now())
                        .status(ExecutionStatus.RUNNING)
                        .build())
                .variables(variables)
                .build();
    }

    public void addError(ToolError toolError) {
        errors.add(toolError);
    }
}
