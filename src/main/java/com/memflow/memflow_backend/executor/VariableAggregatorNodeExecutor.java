package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.exception.SelectorException;
import com.memflow.memflow_backend.model.config.VariableAggregatorNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the first selector that resolves to a non-null value. Typically placed after
 * the branches of an if-else to merge whichever branch actually ran.
 */
@Slf4j
@Component
public class VariableAggregatorNodeExecutor implements NodeExecutor<VariableAggregatorNodeConfig> {

    @Override
    public NodeType supportedType() {
        return NodeType.VARIABLE_AGGREGATOR;
    }

    @Override
    public Class<VariableAggregatorNodeConfig> configType() {
        return VariableAggregatorNodeConfig.class;
    }

    @Override
    public Object execute(WorkflowNode<VariableAggregatorNodeConfig> node, NodeExecutionContext ctx) {
        VariableAggregatorNodeConfig config = node.getConfig();
        VariablePool pool = ctx.getPool();
        if (!config.isGroup()) {
            Object value = firstPresent(config.flatSelectors(), pool, node.getId());
            if (value == null) {
                log.info("Variable aggregator {} found no value, returning empty string", node.getId());
                return "";
            }
            return value;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < config.getGroupNames().size(); i++) {
            String group = config.getGroupNames().get(i);
            Object value = firstPresent(config.selectorsOfGroup(i), pool, node.getId());
            result.put(group, value != null ? value : "");
        }
        return result;
    }

    private static Object firstPresent(List<String> selectors, VariablePool pool, String nodeId) {
        for (String selector : selectors) {
            String path = ExpressionEvaluator.stripDelimiters(selector).trim();
            try {
                Object value = pool.get(path);
                if (value != null) return value;
            } catch (SelectorException e) {
                log.debug("Variable aggregator {}: {} not available ({})", nodeId, path, e.getMessage());
            }
        }
        return null;
    }
}
