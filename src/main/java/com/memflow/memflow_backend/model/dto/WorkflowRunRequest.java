package com.memflow.memflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Body of a run call. {@code conversationVariables}, when present, replace the values
 * restored from the previous turn of the same conversation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowRunRequest(
        String message,
        String conversationId,
        String workspaceId,
        String userId,
        Map<String, Object> inputs,
        Map<String, Object> conversationVariables
) {}
