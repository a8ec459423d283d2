package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.TemplatePart;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.config.JinjaRenderNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@code template} against a local context built from {@code mapping}.
 * Both steps are lenient: a missing variable renders as empty text.
 *
 * <p>A mapping whose value is a single placeholder binds the value itself, so a list can be
 * looped over with {@code {% for %}}; any other mapping value is rendered to text.</p>
 */
@Component
@RequiredArgsConstructor
public class JinjaRenderNodeExecutor implements NodeExecutor<JinjaRenderNodeConfig> {

    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.JINJA_RENDER;
    }

    @Override
    public Class<JinjaRenderNodeConfig> configType() {
        return JinjaRenderNodeConfig.class;
    }

    @Override
    public void validate(JinjaRenderNodeConfig config) {
        config.validate();
        List<String> errors = renderer.validate(config.getTemplate());
        if (!errors.isEmpty()) {
            throw new ConfigurationException("template", errors.get(0));
        }
    }

    @Override
    public Object execute(WorkflowNode<JinjaRenderNodeConfig> node, NodeExecutionContext ctx) {
        Map<String, Object> local = new LinkedHashMap<>();
        for (JinjaRenderNodeConfig.VariableMapping mapping : node.getConfig().getMapping()) {
            local.put(mapping.getName(), mappedValue(mapping.getValue(), ctx));
        }
        String text = renderer.render(node.getConfig().getTemplate(), local, Map.of(), ctx.systemVars(), false);
        return Map.of("output", text);
    }

    private Object mappedValue(String source, NodeExecutionContext ctx) {
        List<TemplatePart> parts = renderer.parse(source);
        if (parts.size() == 1 && parts.get(0) instanceof TemplatePart.Placeholder placeholder) {
            return placeholder.expression().evaluate(ctx.renderScope(false));
        }
        return ctx.render(source, false);
    }
}
