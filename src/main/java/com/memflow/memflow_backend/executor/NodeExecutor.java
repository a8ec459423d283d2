package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.model.config.NodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;

/**
 * Implementation of one node type. Executors are stateless singletons; per-node settings
 * arrive through {@link WorkflowNode#getConfig()}.
 *
 * @param <C> typed configuration bound from the node's JSON config
 */
public interface NodeExecutor<C extends NodeConfig> {

    NodeType supportedType();

    Class<C> configType();

    /** Graph-build time check. Throws {@link com.memflow.memflow_backend.exception.ConfigurationException}. */
    default void validate(C config) {
        config.validate();
    }

    /**
     * Build-time work done once per node, such as compiling conditions. Runs after
     * {@link #validate}; the result is handed back through {@link WorkflowNode#getPrepared()}.
     */
    default Object prepare(C config) {
        return null;
    }

    /**
     * Runs the node. A {@code Map} result is stored as the node's output; anything else is
     * stored as {@code {"output": result}}.
     */
    Object execute(WorkflowNode<C> node, NodeExecutionContext ctx);

    // ── Routing ──────────────────────────────────────────────────────────────

    /** Whether only edges whose label matches {@link #routingLabel} are followed. */
    default boolean isRouting(C config) {
        return false;
    }

    /** Label picked by a routing node, read from its stored output. */
    default String routingLabel(C config, Object output) {
        return null;
    }

    /** Label given to the {@code index}-th unlabeled outgoing edge of a routing node. */
    default String defaultEdgeLabel(C config, int index) {
        return null;
    }

    // ── Streaming ────────────────────────────────────────────────────────────

    /** Whether the node pushes partial output through {@link NodeExecutionContext#emitChunk}. */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Text this node would emit ahead of {@code upstreamNodeId}'s streamed output, or
     * {@code null} when the node's output does not start with that node's stream.
     */
    default String streamingPrefix(WorkflowNode<C> node, String upstreamNodeId, NodeExecutionContext ctx) {
        return null;
    }
}
