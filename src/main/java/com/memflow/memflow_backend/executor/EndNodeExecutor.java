package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.EvaluationScope;
import com.memflow.memflow_backend.engine.expression.TemplatePart;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.config.EndNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the final answer. In streaming runs the part of the answer that an upstream
 * node already streamed is not sent again: only the text after that node's placeholder
 * is emitted, while the full rendering is still returned as the result.
 */
@Slf4j
@Component
public class EndNodeExecutor implements NodeExecutor<EndNodeConfig> {

    private final TemplateRenderer renderer;
    private final String defaultOutput;

    public EndNodeExecutor(TemplateRenderer renderer,
                           @Value("${app.workflow.end-default-output:Workflow completed}") String defaultOutput) {
        this.renderer = renderer;
        this.defaultOutput = defaultOutput;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.END;
    }

    @Override
    public Class<EndNodeConfig> configType() {
        return EndNodeConfig.class;
    }

    @Override
    public void validate(EndNodeConfig config) {
        config.validate();
        if (hasTemplate(config)) {
            List<String> errors = renderer.validate(config.getOutput());
            if (!errors.isEmpty()) {
                throw new ConfigurationException("output", errors.get(0));
            }
        }
    }

    @Override
    public Object execute(WorkflowNode<EndNodeConfig> node, NodeExecutionContext ctx) {
        if (!hasTemplate(node.getConfig())) {
            ctx.emitChunk(defaultOutput);
            return defaultOutput;
        }
        List<TemplatePart> parts = renderer.parse(node.getConfig().getOutput());
        EvaluationScope scope = ctx.renderScope(true);
        String full = renderer.render(parts, scope);
        if (!ctx.isStreaming()) {
            return full;
        }

        StreamingOutputSplitter.Split split = StreamingOutputSplitter.split(parts, ctx.getPredecessors());
        if (split == null || !ctx.getState().getStreamingBuffer().containsKey(split.anchorNodeId())) {
            ctx.emitChunk(full);
            return full;
        }
        String suffix = renderer.render(split.suffix(), scope);
        log.debug("End node {} emits suffix after streamed node {}", node.getId(), split.anchorNodeId());
        ctx.emitChunk(suffix);
        return full;
    }

    @Override
    public String streamingPrefix(WorkflowNode<EndNodeConfig> node, String upstreamNodeId, NodeExecutionContext ctx) {
        if (!hasTemplate(node.getConfig())) return null;
        List<TemplatePart> parts = renderer.parse(node.getConfig().getOutput());
        StreamingOutputSplitter.Split split = StreamingOutputSplitter.split(parts, ctx.getPredecessors());
        if (split == null || !upstreamNodeId.equals(split.anchorNodeId())) {
            return null;
        }
        return renderer.render(split.prefix(), ctx.renderScope(true));
    }

    private static boolean hasTemplate(EndNodeConfig config) {
        return config.getOutput() != null && !config.getOutput().isBlank();
    }
}
