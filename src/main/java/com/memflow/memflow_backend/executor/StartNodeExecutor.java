package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.config.StartNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import com.memflow.memflow_backend.model.workflow.VariableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class StartNodeExecutor implements NodeExecutor<StartNodeConfig> {

    @Override
    public NodeType supportedType() {
        return NodeType.START;
    }

    @Override
    public Class<StartNodeConfig> configType() {
        return StartNodeConfig.class;
    }

    @Override
    public void validate(StartNodeConfig config) {
        config.validate();
        List<String> errors = ExpressionEvaluator.validateVariableNames(
                config.getVariables().stream().map(VariableDefinition::getName).toList());
        if (!errors.isEmpty()) {
            throw new ConfigurationException("variables", errors.get(0));
        }
    }

    // Publishes the system facts plus the declared input variables read from sys.input_variables
    @Override
    @SuppressWarnings("unchecked")
    public Object execute(WorkflowNode<StartNodeConfig> node, NodeExecutionContext ctx) {
        VariablePool pool = ctx.getPool();
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("message", pool.get("sys.message", null));
        output.put("execution_id", pool.get("sys.execution_id", null));
        output.put("conversation_id", pool.get("sys.conversation_id", null));
        output.put("workspace_id", pool.get("sys.workspace_id", null));
        output.put("user_id", pool.get("sys.user_id", null));

        Object raw = pool.get("sys.input_variables", null);
        Map<String, Object> inputs = raw instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
        for (VariableDefinition variable : node.getConfig().getVariables()) {
            String name = variable.getName();
            if (inputs.containsKey(name)) {
                output.put(name, inputs.get(name));
            } else if (variable.isRequired()) {
                throw new ConfigurationException("variables." + name, "Missing required input variable: " + name
                        + (variable.getDescription() != null ? " (" + variable.getDescription() + ")" : ""));
            } else if (variable.getDefaultValue() != null) {
                output.put(name, variable.getDefaultValue());
            }
        }
        log.info("Start node {} published {} custom input variable(s)", node.getId(), node.getConfig().getVariables().size());
        return output;
    }
}
