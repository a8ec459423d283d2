package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.ExecutionListener;
import com.memflow.memflow_backend.engine.expression.EvaluationScope;
import com.memflow.memflow_backend.engine.expression.Expression;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.model.state.StreamingBuffer;
import com.memflow.memflow_backend.model.state.TokenUsage;
import com.memflow.memflow_backend.model.state.ToolError;
import com.memflow.memflow_backend.model.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;

/**
 * Everything a node may touch while it executes: the variable pool of the run, the
 * evaluation helpers, and the channels for chunks, token usage and tool errors.
 * One instance per node execution.
 *
 * <p>Once the engine {@linkplain #cancel() cancels} the context, a node still running on
 * its thread can no longer write conversation variables, emit chunks or record tool errors.</p>
 */
@Slf4j
public class NodeExecutionContext {

    private final String nodeId;
    private final VariablePool pool;
    private final ExpressionEvaluator evaluator;
    private final TemplateRenderer renderer;
    private final ExecutionListener listener;
    private final boolean streaming;
    private final Set<String> predecessors;

    private volatile boolean cancelled;
    private TokenUsage tokenUsage = TokenUsage.ZERO;

    public NodeExecutionContext(String nodeId,
                                VariablePool pool,
                                ExpressionEvaluator evaluator,
                                TemplateRenderer renderer,
                                ExecutionListener listener,
                                boolean streaming,
                                Set<String> predecessors) {
        this.nodeId = nodeId;
        this.pool = pool.writableWhile(() -> !cancelled);
        this.evaluator = evaluator;
        this.renderer = renderer;
        this.listener = listener != null ? listener : ExecutionListener.NONE;
        this.streaming = streaming;
        this.predecessors = predecessors != null ? predecessors : Set.of();
    }

    public String getNodeId() {
        return nodeId;
    }

    public VariablePool getPool() {
        return pool;
    }

    public WorkflowState getState() {
        return pool.getState();
    }

    public String getExecutionId() {
        return getState().getMeta().getExecutionId();
    }

    public boolean isStreaming() {
        return streaming;
    }

    /** Ids of the nodes with an edge into this one. */
    public Set<String> getPredecessors() {
        return predecessors;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Detaches this execution from the run's state. Called when the node timed out. */
    public void cancel() {
        cancelled = true;
    }

    public TokenUsage getTokenUsage() {
        return tokenUsage;
    }

    // ── Variables ────────────────────────────────────────────────────────────

    public Map<String, Object> conversationVars() {
        return pool.getAllConversationVars();
    }

    public Map<String, Object> nodeOutputs() {
        return pool.getAllNodeOutputs();
    }

    public Map<String, Object> systemVars() {
        return pool.getAllSystemVars();
    }

    public String render(String template, boolean strict) {
        return renderer.render(template, conversationVars(), nodeOutputs(), systemVars(), strict);
    }

    public EvaluationScope renderScope(boolean strict) {
        return renderer.scope(conversationVars(), nodeOutputs(), systemVars(), strict);
    }

    public TemplateRenderer getRenderer() {
        return renderer;
    }

    public Object evaluate(String expression) {
        return evaluator.evaluate(expression, conversationVars(), nodeOutputs(), systemVars());
    }

    public Object evaluate(Expression expression) {
        return evaluator.evaluate(expression, conversationVars(), nodeOutputs(), systemVars());
    }

    public boolean evaluateBool(Expression expression) {
        return evaluator.evaluateBool(expression, conversationVars(), nodeOutputs(), systemVars());
    }

    // ── Side channels ────────────────────────────────────────────────────────

    /** Appends a chunk to this node's streaming buffer and forwards it. Ignored outside streaming runs. */
    public void emitChunk(String chunk) {
        if (!streaming || chunk == null || chunk.isEmpty()) return;
        if (cancelled) {
            log.debug("Dropping chunk of cancelled node {}", nodeId);
            return;
        }
        getState().getStreamingBuffer()
                .computeIfAbsent(nodeId, id -> new StreamingBuffer())
                .append(chunk);
        log.debug("Node {} emitted chunk of {} chars", nodeId, chunk.length());
        listener.chunk(getExecutionId(), nodeId, chunk);
    }

    public void recordTokenUsage(TokenUsage usage) {
        if (cancelled) return;
        tokenUsage = tokenUsage.plus(usage);
    }

    /** Records a non-fatal failure of an external call made by this node. */
    public void recordToolError(String tool, String error) {
        if (cancelled) {
            log.debug("Dropping tool error of cancelled node {}: {}", nodeId, error);
            return;
        }
        log.warn("Node {} tool '{}' failed: {}", nodeId, tool, error);
        getState().addError(new ToolError(tool, nodeId, error));
    }
}
