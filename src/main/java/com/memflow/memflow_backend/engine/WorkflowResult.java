package com.memflow.memflow_backend.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import com.memflow.memflow_backend.model.state.NodeResult;
import com.memflow.memflow_backend.model.state.TokenUsage;
import com.memflow.memflow_backend.model.state.ToolError;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one run.
 *
 * @param output                text rendered by the last end node that ran
 * @param conversationVariables {@code conv.*} after the run, to be persisted by the caller
 * @param error                 set when a node failed, either aborting the run or routing to an error edge
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowResult(
        String executionId,
        String workflowId,
        ExecutionStatus status,
        String output,
        Map<String, Object> conversationVariables,
        Map<String, NodeResult> nodeResults,
        List<String> nodeExecutionOrder,
        TokenUsage tokenUsage,
        List<ToolError> errors,
        String error,
        String errorNode,
        long elapsedMs
) {
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
