package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.engine.variable.VariableSelector;
import com.memflow.memflow_backend.executor.assign.AssignmentOperators;
import com.memflow.memflow_backend.model.config.AssignerNodeConfig;
import com.memflow.memflow_backend.model.config.AssignerNodeConfig.AssignmentItem;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies typed operations to conversation variables, in declared order. Each assignment
 * sees the writes of the ones before it.
 */
@Slf4j
@Component
public class AssignerNodeExecutor implements NodeExecutor<AssignerNodeConfig> {

    @Override
    public NodeType supportedType() {
        return NodeType.ASSIGNER;
    }

    @Override
    public Class<AssignerNodeConfig> configType() {
        return AssignerNodeConfig.class;
    }

    @Override
    public Object execute(WorkflowNode<AssignerNodeConfig> node, NodeExecutionContext ctx) {
        VariablePool pool = ctx.getPool();
        Map<String, Object> written = new LinkedHashMap<>();
        for (AssignmentItem item : node.getConfig().allAssignments()) {
            VariableSelector selector = item.selector();
            Object current = pool.get(selector, null);
            Object value = item.getOperation().takesValue() ? resolveValue(item.getValue(), ctx) : null;
            Object updated = AssignmentOperators.apply(item.getOperation(), current, value);
            pool.set(selector, updated);
            written.put(selector.key(), updated);
            log.debug("Assigner {}: {} {} -> {}", node.getId(), item.getOperation().getValue(), selector, updated);
        }
        return written;
    }

    // strings are expressions ("{{llm.output}}", "5", "'text'"); other JSON values are taken as-is
    private static Object resolveValue(Object raw, NodeExecutionContext ctx) {
        if (raw instanceof String expression) {
            return ctx.evaluate(expression);
        }
        return raw;
    }
}
