package com.memflow.memflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.engine.ExecutionListener;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.model.state.WorkflowState;
import com.memflow.memflow_backend.model.workflow.NodeDefinition;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds nodes and execution contexts for executor tests without a Spring context.
 */
public final class NodeTestSupport {

    public static final ExpressionEvaluator EVALUATOR = new ExpressionEvaluator();
    public static final TemplateRenderer RENDERER = new TemplateRenderer();
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private NodeTestSupport() {
    }

    public static NodeFactory factory(NodeExecutor<?>... executors) {
        NodeFactory factory = new NodeFactory(List.of(executors), MAPPER);
        factory.init();
        return factory;
    }

    public static NodeDefinition definition(String id, String type, Map<String, Object> config) {
        NodeDefinition definition = new NodeDefinition();
        definition.setId(id);
        definition.setType(type);
        definition.setConfig(config);
        return definition;
    }

    public static WorkflowState state(Map<String, Object> sys, Map<String, Object> conv) {
        return WorkflowState.create("wf-test", "exec-test", sys, conv);
    }

    public static NodeExecutionContext context(WorkflowState state, String nodeId) {
        return context(state, nodeId, false, Set.of(), ExecutionListener.NONE);
    }

    public static NodeExecutionContext context(WorkflowState state, String nodeId, boolean streaming,
                                               Set<String> predecessors, ExecutionListener listener) {
        return new NodeExecutionContext(nodeId, new VariablePool(state), EVALUATOR, RENDERER,
                listener, streaming, predecessors);
    }
}
