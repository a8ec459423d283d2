package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.exception.InvalidExpressionException;
import com.memflow.memflow_backend.executor.branch.BranchCompiler;
import com.memflow.memflow_backend.executor.branch.CompiledBranch;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Routes to the first case whose conditions hold, or to the trailing else branch.
 * Returns the routing label {@code CASE1}..{@code CASE{N+1}}.
 */
@Slf4j
@Component
public class IfElseNodeExecutor implements NodeExecutor<IfElseNodeConfig> {

    private final BranchCompiler compiler;

    public IfElseNodeExecutor(ExpressionEvaluator evaluator) {
        this.compiler = new BranchCompiler(evaluator);
    }

    @Override
    public NodeType supportedType() {
        return NodeType.IF_ELSE;
    }

    @Override
    public Class<IfElseNodeConfig> configType() {
        return IfElseNodeConfig.class;
    }

    /** Compiles the cases once; every execution of the node reuses the result. */
    @Override
    public List<CompiledBranch> prepare(IfElseNodeConfig config) {
        try {
            return compiler.compile(config);
        } catch (InvalidExpressionException e) {
            throw new ConfigurationException("cases", "Invalid condition: " + e.getMessage());
        }
    }

    @Override
    public Object execute(WorkflowNode<IfElseNodeConfig> node, NodeExecutionContext ctx) {
        List<CompiledBranch> branches = node.getPrepared();
        CompiledBranch selected = BranchCompiler.select(branches, ctx::evaluateBool);
        log.info("If-else node {} selected {}{}", node.getId(), selected.label(), selected.fallback() ? " (else)" : "");
        return selected.label();
    }

    @Override
    public boolean isRouting(IfElseNodeConfig config) {
        return true;
    }

    @Override
    public String routingLabel(IfElseNodeConfig config, Object output) {
        return output instanceof Map<?, ?> map ? String.valueOf(map.get("output")) : String.valueOf(output);
    }

    @Override
    public String defaultEdgeLabel(IfElseNodeConfig config, int index) {
        return BranchCompiler.label(index);
    }
}
