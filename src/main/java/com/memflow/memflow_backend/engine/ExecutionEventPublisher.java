package com.memflow.memflow_backend.engine;

import com.memflow.memflow_backend.model.state.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes execution events to {@code /topic/execution/{executionId}}. Goes through Redis
 * when the bridge is enabled so clients connected to another instance receive them too.
 */
@Slf4j
@Component
public class ExecutionEventPublisher implements ExecutionListener {

    // Clients subscribe to /topic/execution/{executionId} to receive live updates
    public static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    @Override
    public void workflowStarted(String executionId, String workflowId) {
        Map<String, Object> payload = event("workflow_started");
        payload.put("workflowId", workflowId);
        publish(executionId, payload);
    }

    @Override
    public void nodeStarted(String executionId, String nodeId) {
        publish(executionId, nodeEvent(nodeId, NodeStatus.RUNNING, null));
    }

    @Override
    public void nodeCompleted(String executionId, String nodeId, NodeStatus status) {
        publish(executionId, nodeEvent(nodeId, status, null));
    }

    @Override
    public void nodeError(String executionId, String nodeId, String error) {
        publish(executionId, nodeEvent(nodeId, NodeStatus.FAILURE, error));
    }

    @Override
    public void chunk(String executionId, String nodeId, String chunk) {
        Map<String, Object> payload = event("chunk");
        payload.put("nodeId", nodeId);
        payload.put("content", chunk);
        publish(executionId, payload);
    }

    @Override
    public void workflowCompleted(String executionId, WorkflowResult result) {
        Map<String, Object> payload = event("workflow_completed");
        payload.put("status", result.status().name());
        payload.put("output", result.output() != null ? result.output() : "");
        payload.put("error", result.error() != null ? result.error() : "");
        payload.put("elapsedMs", result.elapsedMs());
        publish(executionId, payload);
    }

    private static Map<String, Object> event(String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", type);
        return payload;
    }

    private static Map<String, Object> nodeEvent(String nodeId, NodeStatus status, String error) {
        Map<String, Object> payload = event("node");
        payload.put("nodeId", nodeId);
        payload.put("status", status.name());
        payload.put("error", error != null ? error : "");
        return payload;
    }

    private void publish(String executionId, Map<String, Object> payload) {
        String destination = TOPIC + executionId;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing {} to {} via {}", payload.get("event"), destination, bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
