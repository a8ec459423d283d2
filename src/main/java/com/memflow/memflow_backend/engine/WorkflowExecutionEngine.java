package com.memflow.memflow_backend.engine;

import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.engine.variable.VariablePool;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.exception.NodeExecutionException;
import com.memflow.memflow_backend.exception.WorkflowException;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeFactory;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import com.memflow.memflow_backend.model.state.NodeResult;
import com.memflow.memflow_backend.model.state.NodeStatus;
import com.memflow.memflow_backend.model.state.TokenUsage;
import com.memflow.memflow_backend.model.state.WorkflowState;
import com.memflow.memflow_backend.model.workflow.NodeType;
import com.memflow.memflow_backend.model.workflow.VariableDefinition;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a workflow graph one node at a time.
 *
 * <p>Scheduling uses dead-path elimination: once a node finishes, each of its outgoing
 * edges is marked taken or not taken. A node becomes ready when all of its incoming edges
 * are decided; it runs if at least one of them was taken and is skipped otherwise, which
 * in turn marks its own outgoing edges as not taken.</p>
 *
 * <p>A node that throws aborts the run with {@link NodeExecutionException}, unless it has
 * an outgoing {@code error} edge, in which case only its error edges are followed.</p>
 */
@Slf4j
@Service
public class WorkflowExecutionEngine {

    private enum EdgeState { PENDING, TAKEN, NOT_TAKEN }

    private final NodeFactory nodeFactory;
    private final ExpressionEvaluator evaluator;
    private final TemplateRenderer renderer;
    private final long nodeTimeoutSeconds;
    private final ExecutorService nodeThreads = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "workflow-node");
        thread.setDaemon(true);
        return thread;
    });

    public WorkflowExecutionEngine(NodeFactory nodeFactory,
                                   ExpressionEvaluator evaluator,
                                   TemplateRenderer renderer,
                                   @Value("${app.workflow.node-timeout-seconds:60}") long nodeTimeoutSeconds) {
        this.nodeFactory = nodeFactory;
        this.evaluator = evaluator;
        this.renderer = renderer;
        this.nodeTimeoutSeconds = nodeTimeoutSeconds;
    }

    @PreDestroy
    void shutdown() {
        nodeThreads.shutdownNow();
    }

    // ── Validation ───────────────────────────────────────────────────────────

    public WorkflowGraph buildGraph(WorkflowDefinition definition) {
        return WorkflowGraph.build(definition, nodeFactory);
    }

    /** Every configuration problem of the definition; empty when it can run. */
    public List<ValidationError> validate(WorkflowDefinition definition) {
        try {
            buildGraph(definition);
            return List.of();
        } catch (ConfigurationException e) {
            return e.getErrors().isEmpty()
                    ? List.of(new ValidationError("workflow", e.getMessage()))
                    : e.getErrors();
        }
    }

    // ── Execution ────────────────────────────────────────────────────────────

    public WorkflowResult execute(WorkflowDefinition definition, WorkflowInput input) {
        return execute(definition, input, ExecutionListener.NONE, false);
    }

    /**
     * Runs the workflow to completion.
     *
     * @param streaming whether nodes push partial output to {@code listener} as chunks
     * @throws ConfigurationException when the definition is invalid; nothing has run yet
     * @throws NodeExecutionException when a node without an error edge fails
     */
    public WorkflowResult execute(WorkflowDefinition definition, WorkflowInput input,
                                  ExecutionListener listener, boolean streaming) {
        WorkflowGraph graph = buildGraph(definition);
        ExecutionListener events = listener != null ? listener : ExecutionListener.NONE;

        String executionId = input.getExecutionId() != null ? input.getExecutionId() : UUID.randomUUID().toString();
        WorkflowState state = WorkflowState.create(input.getWorkflowId(), executionId,
                systemVariables(input, executionId), conversationVariables(definition, input));
        VariablePool pool = new VariablePool(state);

        log.info("Workflow {} execution {} started (streaming={})", input.getWorkflowId(), executionId, streaming);
        events.workflowStarted(executionId, input.getWorkflowId());

        Run run = new Run(graph, state, pool, events, streaming);
        try {
            run.drive();
        } catch (NodeExecutionException e) {
            WorkflowResult failed = finish(run, ExecutionStatus.FAILURE, e.getMessage());
            log.error("Workflow execution {} aborted at node {}: {}", executionId, e.getNodeId(), e.getMessage());
            events.workflowCompleted(executionId, failed);
            throw e;
        }

        WorkflowResult result = finish(run, ExecutionStatus.SUCCESS, state.getError());
        log.info("Workflow execution {} completed in {} ms ({} nodes)",
                executionId, result.elapsedMs(), state.getNodeExecutionOrder().size());
        events.workflowCompleted(executionId, result);
        return result;
    }

    private static Map<String, Object> systemVariables(WorkflowInput input, String executionId) {
        Map<String, Object> sys = new LinkedHashMap<>();
        sys.put("message", input.getMessage() != null ? input.getMessage() : "");
        sys.put("conversation_id", input.getConversationId());
        sys.put("execution_id", executionId);
        sys.put("workspace_id", input.getWorkspaceId());
        sys.put("user_id", input.getUserId());
        sys.put("input_variables", input.getInputVariables() != null ? input.getInputVariables() : Map.of());
        return sys;
    }

    private static Map<String, Object> conversationVariables(WorkflowDefinition definition, WorkflowInput input) {
        Map<String, Object> conv = new LinkedHashMap<>();
        if (definition.getVariables() != null) {
            for (VariableDefinition variable : definition.getVariables()) {
                conv.put(variable.getName(), variable.getDefaultValue());
            }
        }
        if (input.getConversationVariables() != null) {
            conv.putAll(input.getConversationVariables());
        }
        return conv;
    }

    private WorkflowResult finish(Run run, ExecutionStatus status, String error) {
        WorkflowState state = run.state;
        state.getMeta().setStatus(status);
        state.getMeta().setCompletedAt(Instant.now());
        state.getMeta().setErrorMessage(error);
        long elapsed = state.getMeta().getCompletedAt().toEpochMilli() - state.getMeta().getStartedAt().toEpochMilli();

        return new WorkflowResult(
                state.getMeta().getExecutionId(),
                state.getMeta().getWorkflowId(),
                status,
                run.finalOutput,
                new LinkedHashMap<>(run.pool.getAllConversationVars()),
                new LinkedHashMap<>(state.getNodeResults()),
                List.copyOf(state.getNodeExecutionOrder()),
                run.tokenUsage,
                List.copyOf(state.getErrors()),
                error,
                state.getErrorNode(),
                elapsed);
    }

    // ── One run ──────────────────────────────────────────────────────────────

    private final class Run {

        private final WorkflowGraph graph;
        private final WorkflowState state;
        private final VariablePool pool;
        private final ExecutionListener listener;
        private final boolean streaming;
        private final Map<WorkflowGraph.Edge, EdgeState> edgeStates = new HashMap<>();

        private TokenUsage tokenUsage = TokenUsage.ZERO;
        private String finalOutput;

        Run(WorkflowGraph graph, WorkflowState state, VariablePool pool, ExecutionListener listener, boolean streaming) {
            this.graph = graph;
            this.state = state;
            this.pool = pool;
            this.listener = listener;
            this.streaming = streaming;
            graph.getEdges().forEach(edge -> edgeStates.put(edge, EdgeState.PENDING));
        }

        void drive() {
            Deque<String> ready = new ArrayDeque<>();
            ready.add(graph.getStartNodeId());
            while (!ready.isEmpty()) {
                String nodeId = ready.poll();
                WorkflowNode<?> node = graph.node(nodeId);

                boolean anyTaken = nodeId.equals(graph.getStartNodeId()) || graph.incoming(nodeId).stream()
                        .anyMatch(edge -> edgeStates.get(edge) == EdgeState.TAKEN);

                List<WorkflowGraph.Edge> taken = anyTaken ? runNode(node) : skip(node);
                for (WorkflowGraph.Edge edge : graph.outgoing(nodeId)) {
                    edgeStates.put(edge, taken.contains(edge) ? EdgeState.TAKEN : EdgeState.NOT_TAKEN);
                }
                for (String next : graph.successors(nodeId)) {
                    boolean decided = graph.incoming(next).stream()
                            .allMatch(edge -> edgeStates.get(edge) != EdgeState.PENDING);
                    if (decided && !ready.contains(next)) {
                        ready.add(next);
                    }
                }
            }
        }

        private List<WorkflowGraph.Edge> skip(WorkflowNode<?> node) {
            log.debug("Skipping node {}: no incoming edge was taken", node.getId());
            state.getNodeResults().put(node.getId(), NodeResult.builder()
                    .nodeId(node.getId())
                    .nodeType(node.getType().getTag())
                    .nodeName(node.getName())
                    .status(NodeStatus.SKIPPED)
                    .build());
            listener.nodeCompleted(state.getMeta().getExecutionId(), node.getId(), NodeStatus.SKIPPED);
            return List.of();
        }

        private List<WorkflowGraph.Edge> runNode(WorkflowNode<?> node) {
            String executionId = state.getMeta().getExecutionId();
            state.getMeta().setCurrentNodeId(node.getId());
            listener.nodeStarted(executionId, node.getId());

            if (streaming && node.supportsStreaming()) {
                emitEndNodePrefixes(node.getId());
            }

            NodeExecutionContext ctx = context(node.getId());
            long started = System.currentTimeMillis();
            NodeResult.NodeResultBuilder audit = NodeResult.builder()
                    .nodeId(node.getId())
                    .nodeType(node.getType().getTag())
                    .nodeName(node.getName())
                    .input(node.getDefinition().getConfig());

            try {
                Object result = invoke(node, ctx);
                Object stored = result instanceof Map<?, ?> ? result : singletonOutput(result);
                state.getRuntimeVars().put(node.getId(), stored);
                state.getNodeExecutionOrder().add(node.getId());
                tokenUsage = tokenUsage.plus(ctx.getTokenUsage());
                if (node.getType() == NodeType.END) {
                    finalOutput = result != null ? result.toString() : "";
                }

                state.getNodeResults().put(node.getId(), audit
                        .status(NodeStatus.SUCCESS)
                        .output(stored)
                        .elapsedMs(System.currentTimeMillis() - started)
                        .tokenUsage(ctx.getTokenUsage())
                        .build());
                log.info("Node {} ({}) completed in {} ms", node.getId(), node.getType().getTag(),
                        System.currentTimeMillis() - started);
                listener.nodeCompleted(executionId, node.getId(), NodeStatus.SUCCESS);
                return selectEdges(node, stored);

            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                state.getNodeExecutionOrder().add(node.getId());
                state.getNodeResults().put(node.getId(), audit
                        .status(NodeStatus.FAILURE)
                        .elapsedMs(System.currentTimeMillis() - started)
                        .tokenUsage(ctx.getTokenUsage())
                        .errorMessage(message)
                        .build());
                tokenUsage = tokenUsage.plus(ctx.getTokenUsage());
                listener.nodeError(executionId, node.getId(), message);

                if (!graph.hasErrorEdge(node.getId())) {
                    throw e instanceof NodeExecutionException nee && node.getId().equals(nee.getNodeId())
                            ? nee
                            : new NodeExecutionException(node.getId(), message, e);
                }
                log.warn("Node {} failed, following its error edge: {}", node.getId(), message);
                state.setError(message);
                state.setErrorNode(node.getId());
                Map<String, Object> errorOutput = new LinkedHashMap<>();
                errorOutput.put("error", message);
                state.getRuntimeVars().put(node.getId(), errorOutput);
                return graph.outgoing(node.getId()).stream().filter(WorkflowGraph.Edge::errorEdge).toList();
            }
        }

        private List<WorkflowGraph.Edge> selectEdges(WorkflowNode<?> node, Object output) {
            List<WorkflowGraph.Edge> normal = graph.outgoing(node.getId()).stream()
                    .filter(edge -> !edge.errorEdge())
                    .toList();
            if (!node.isRouting()) {
                return normal;
            }
            String label = node.routingLabel(output);
            List<WorkflowGraph.Edge> matching = normal.stream()
                    .filter(edge -> label != null && label.equals(edge.label()))
                    .toList();
            if (matching.isEmpty() && !normal.isEmpty()) {
                log.warn("Node {} routed to '{}' but no outgoing edge carries that label", node.getId(), label);
            }
            return matching;
        }

        private Object invoke(WorkflowNode<?> node, NodeExecutionContext ctx) {
            if (nodeTimeoutSeconds <= 0) {
                return node.execute(ctx);
            }
            Future<Object> future = nodeThreads.submit(() -> node.execute(ctx));
            try {
                return future.get(nodeTimeoutSeconds, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                abandon(ctx, future);
                throw new NodeExecutionException(node.getId(), "timed out after " + nodeTimeoutSeconds + " s", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(ctx, future);
                throw new NodeExecutionException(node.getId(), "interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) throw runtime;
                if (cause instanceof Error error) throw error;
                throw new NodeExecutionException(node.getId(), String.valueOf(cause), cause);
            }
        }

        /** Cuts the node off from the run's state first, then interrupts its thread. */
        private void abandon(NodeExecutionContext ctx, Future<Object> future) {
            ctx.cancel();
            future.cancel(true);
        }

        /** Sends the text each end node renders ahead of {@code upstreamId}'s streamed output. */
        private void emitEndNodePrefixes(String upstreamId) {
            for (String successor : graph.successors(upstreamId)) {
                WorkflowNode<?> candidate = graph.node(successor);
                if (candidate.getType() != NodeType.END) continue;
                NodeExecutionContext endCtx = context(successor);
                try {
                    String prefix = candidate.streamingPrefix(upstreamId, endCtx);
                    if (prefix != null) {
                        endCtx.emitChunk(prefix);
                    }
                } catch (WorkflowException e) {
                    log.warn("Could not render the streaming prefix of end node {}: {}", successor, e.getMessage());
                }
            }
        }

        private NodeExecutionContext context(String nodeId) {
            return new NodeExecutionContext(nodeId, pool, evaluator, renderer, listener, streaming,
                    graph.predecessors(nodeId));
        }

        private Map<String, Object> singletonOutput(Object value) {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("output", value);
            return output;
        }
    }
}
