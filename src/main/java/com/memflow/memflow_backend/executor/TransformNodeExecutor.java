package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.config.TransformNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Config shape:
 * {
 *   "output": {
 *     "greeting": "Hello {{conv.name}}",
 *     "summary": "{{llm.output}}"
 *   }
 * }
 */
@Component
@RequiredArgsConstructor
public class TransformNodeExecutor implements NodeExecutor<TransformNodeConfig> {

    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.TRANSFORM;
    }

    @Override
    public Class<TransformNodeConfig> configType() {
        return TransformNodeConfig.class;
    }

    @Override
    public void validate(TransformNodeConfig config) {
        config.validate();
        config.getOutput().forEach((field, template) -> {
            List<String> errors = renderer.validate(template);
            if (!errors.isEmpty()) {
                throw new ConfigurationException("output." + field, errors.get(0));
            }
        });
    }

    @Override
    public Object execute(WorkflowNode<TransformNodeConfig> node, NodeExecutionContext ctx) {
        Map<String, Object> output = new LinkedHashMap<>();
        node.getConfig().getOutput().forEach((field, template) -> output.put(field, ctx.render(template, true)));
        return output;
    }
}
