package com.memflow.memflow_backend.engine;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What the caller supplies for one run: the inbound message, the ids that end up in
 * {@code sys.*}, the start-node inputs and the persisted conversation variables.
 */
@Value
@Builder
public class WorkflowInput {
    String workflowId;
    String executionId;
    String message;
    String conversationId;
    String workspaceId;
    String userId;

    @Builder.Default
    Map<String, Object> inputVariables = Map.of();

    @Builder.Default
    Map<String, Object> conversationVariables = Map.of();
}
