package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.agent.AgentClient;
import com.memflow.memflow_backend.model.config.AgentNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Forwards a rendered message to another agent and returns its reply. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentNodeExecutor implements NodeExecutor<AgentNodeConfig> {

    private final AgentClient agentClient;
    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.AGENT;
    }

    @Override
    public Class<AgentNodeConfig> configType() {
        return AgentNodeConfig.class;
    }

    @Override
    public void validate(AgentNodeConfig config) {
        config.validate();
        if (config.getMessage() != null) {
            List<String> errors = renderer.validate(config.getMessage());
            if (!errors.isEmpty()) {
                throw new ConfigurationException("message", errors.get(0));
            }
        }
    }

    @Override
    public Object execute(WorkflowNode<AgentNodeConfig> node, NodeExecutionContext ctx) {
        AgentNodeConfig config = node.getConfig();
        String message = config.getMessage() != null ? ctx.render(config.getMessage(), true) : "";

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("conversation_id", ctx.systemVars().get("conversation_id"));
        context.put("user_id", ctx.systemVars().get("user_id"));

        Map<String, Object> output = new LinkedHashMap<>();
        try {
            String reply = agentClient.chat(config.getAgentId(), message, context);
            log.info("Agent node {} got reply from agent {}", node.getId(), config.getAgentId());
            output.put("output", reply);
        } catch (RuntimeException e) {
            ctx.recordToolError("agent", e.getMessage());
            output.put("output", "");
            output.put("error", e.getMessage());
        }
        return output;
    }
}
