package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.executor.NodeFactory;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.agent.AgentClient;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.HashMap;
import java.util.Map;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentNodeExecutorTest {

    @Mock
    private AgentClient agentClient;

    private NodeFactory factory;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        factory = factory(new AgentNodeExecutor(agentClient, RENDERER));
        state = state(Map.of("message", "summarise my week", "conversation_id", "c-1", "user_id", "u-1"), Map.of());
    }

    private WorkflowNode<?> agentNode() {
        return factory.create(definition("agent", "agent", Map.of("agent_id", "planner")));
    }

    @Test
    void forwardsRenderedMessageWithConversationContext() {
        Map<String, Object> expectedContext = new HashMap<>();
        expectedContext.put("conversation_id", "c-1");
        expectedContext.put("user_id", "u-1");
        when(agentClient.chat("planner", "summarise my week", expectedContext)).thenReturn("Busy week.");

        assertEquals(Map.of("output", "Busy week."), agentNode().execute(context(state, "agent")));
    }

    @Test
    void failedCallIsRecorded() {
        when(agentClient.chat(eq("planner"), any(), anyMap())).thenThrow(new ResourceAccessException("connection refused"));

        Map<?, ?> output = (Map<?, ?>) agentNode().execute(context(state, "agent"));

        assertEquals("", output.get("output"));
        assertEquals("connection refused", output.get("error"));
        assertEquals("agent", state.getErrors().get(0).tool());
    }

    @Test
    void agentIdIsRequired() {
        assertThrows(ConfigurationException.class, () -> factory.create(definition("agent", "agent", Map.of())));
    }
}
