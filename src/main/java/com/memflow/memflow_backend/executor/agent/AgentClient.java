package com.memflow.memflow_backend.executor.agent;

import java.util.Map;

/**
 * Boundary to the agent service. Implementations throw an unchecked exception when the
 * call fails.
 */
public interface AgentClient {

    /**
     * Sends one message to the agent and returns its reply text.
     *
     * @param context conversation and user ids forwarded to the agent
     */
    String chat(String agentId, String message, Map<String, Object> context);
}
