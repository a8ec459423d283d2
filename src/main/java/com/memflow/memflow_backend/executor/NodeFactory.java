package com.memflow.memflow_backend.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.config.NodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeDefinition;
import com.memflow.memflow_backend.model.workflow.NodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of node executors keyed by type tag. Turns a {@link NodeDefinition} into a
 * {@link WorkflowNode} with a bound, validated config.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeFactory {

    private final List<NodeExecutor<?>> executors;
    private final ObjectMapper objectMapper;
    private final Map<NodeType, NodeExecutor<?>> registry = new EnumMap<>(NodeType.class);

    @PostConstruct
    public void init() {
        executors.forEach(this::register);
        log.info("Registered {} node types: {}", registry.size(), registry.keySet());
    }

    /** Adds or replaces the executor of a node type. */
    public void register(NodeExecutor<?> executor) {
        if (executor.supportedType() == NodeType.CONDITION) {
            throw new IllegalArgumentException("The condition tag is reserved for edge routing");
        }
        registry.put(executor.supportedType(), executor);
    }

    public boolean isSupported(NodeType type) {
        return registry.containsKey(type);
    }

    /**
     * Builds the node, or returns {@code null} for the reserved {@code condition} tag.
     *
     * @throws ConfigurationException for an unknown type or an invalid config
     */
    public WorkflowNode<?> create(NodeDefinition definition) {
        String nodeId = definition.getId();
        NodeType type = definition.getNodeType();
        if (type == null) {
            throw new ConfigurationException(field(nodeId, "type"), "Unknown node type: " + definition.getType());
        }
        if (type == NodeType.CONDITION) {
            return null;
        }
        NodeExecutor<?> executor = registry.get(type);
        if (executor == null) {
            throw new ConfigurationException(field(nodeId, "type"), "No executor registered for node type: " + type.getTag());
        }
        return bind(definition, executor);
    }

    private <C extends NodeConfig> WorkflowNode<C> bind(NodeDefinition definition, NodeExecutor<C> executor) {
        String nodeId = definition.getId();
        Map<String, Object> raw = definition.getConfig() != null ? definition.getConfig() : new LinkedHashMap<>();
        C config;
        try {
            config = objectMapper.convertValue(raw, executor.configType());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(field(nodeId, "config"),
                    "Invalid config for node '" + nodeId + "': " + rootMessage(e));
        }
        Object prepared;
        try {
            executor.validate(config);
            prepared = executor.prepare(config);
        } catch (ConfigurationException e) {
            if (e.getErrors().isEmpty()) {
                throw new ConfigurationException(field(nodeId, null), e.getMessage());
            }
            throw new ConfigurationException(e.getErrors().stream()
                    .map(error -> new ValidationError(field(nodeId, error.field()), error.message()))
                    .toList());
        }
        return new WorkflowNode<>(definition, config, executor, prepared);
    }

    private static String field(String nodeId, String field) {
        String prefix = "nodes[" + nodeId + "]";
        return field == null || field.isBlank() ? prefix : prefix + "." + field;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
