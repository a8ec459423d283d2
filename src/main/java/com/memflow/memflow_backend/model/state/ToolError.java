package com.memflow.memflow_backend.model.state;

/**
 * Non-fatal failure of an external call made by a node (LLM, HTTP, retrieval, agent).
 */
public record ToolError(String tool, String nodeId, String error) {
}
