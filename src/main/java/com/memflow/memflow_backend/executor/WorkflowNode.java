package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.model.config.NodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeDefinition;
import com.memflow.memflow_backend.model.workflow.NodeType;

/**
 * A node instance of a loaded graph: its definition, its validated typed config and the
 * executor of its type. Immutable once built.
 */
public final class WorkflowNode<C extends NodeConfig> {

    private final NodeDefinition definition;
    private final C config;
    private final NodeExecutor<C> executor;
    private final Object prepared;

    public WorkflowNode(NodeDefinition definition, C config, NodeExecutor<C> executor, Object prepared) {
        this.definition = definition;
        this.config = config;
        this.executor = executor;
        this.prepared = prepared;
    }

    public String getId() {
        return definition.getId();
    }

    public NodeType getType() {
        return executor.supportedType();
    }

    public String getName() {
        return definition.getDisplayName();
    }

    public NodeDefinition getDefinition() {
        return definition;
    }

    public C getConfig() {
        return config;
    }

    /** What the executor's {@code prepare} built for this node; {@code null} if nothing. */
    @SuppressWarnings("unchecked")
    public <T> T getPrepared() {
        return (T) prepared;
    }

    public Object execute(NodeExecutionContext ctx) {
        return executor.execute(this, ctx);
    }

    public boolean isRouting() {
        return executor.isRouting(config);
    }

    public String routingLabel(Object output) {
        return executor.routingLabel(config, output);
    }

    public String defaultEdgeLabel(int index) {
        return executor.defaultEdgeLabel(config, index);
    }

    public boolean supportsStreaming() {
        return executor.supportsStreaming();
    }

    public String streamingPrefix(String upstreamNodeId, NodeExecutionContext ctx) {
        return executor.streamingPrefix(this, upstreamNodeId, ctx);
    }

    @Override
    public String toString() {
        return getType().getTag() + ":" + getId();
    }
}
