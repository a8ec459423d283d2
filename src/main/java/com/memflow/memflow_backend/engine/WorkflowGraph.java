package com.memflow.memflow_backend.engine;

import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.executor.NodeFactory;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.model.workflow.EdgeDefinition;
import com.memflow.memflow_backend.model.workflow.NodeDefinition;
import com.memflow.memflow_backend.model.workflow.NodeType;
import com.memflow.memflow_backend.model.workflow.VariableDefinition;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, immutable graph of one workflow definition. Built once per run.
 *
 * <p>Every node is created through the {@link NodeFactory}; every problem found while
 * building is collected and reported in a single {@link ConfigurationException}.</p>
 */
@Slf4j
public final class WorkflowGraph {

    /** An edge after label resolution. {@code index} is its position in the definition. */
    public record Edge(int index, String source, String target, String label, boolean errorEdge) {}

    private final Map<String, WorkflowNode<?>> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final String startNodeId;
    private final List<String> endNodeIds;

    private WorkflowGraph(Map<String, WorkflowNode<?>> nodes, List<Edge> edges, String startNodeId, List<String> endNodeIds) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.startNodeId = startNodeId;
        this.endNodeIds = List.copyOf(endNodeIds);

        Map<String, List<Edge>> out = new HashMap<>();
        Map<String, List<Edge>> in = new HashMap<>();
        for (Edge edge : edges) {
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = out;
        this.incoming = in;
    }

    // ── Building ─────────────────────────────────────────────────────────────

    public static WorkflowGraph build(WorkflowDefinition definition, NodeFactory factory) {
        List<ValidationError> errors = new ArrayList<>();
        Map<String, WorkflowNode<?>> nodes = new LinkedHashMap<>();
        Set<String> conditionNodes = new HashSet<>();
        String startNodeId = null;
        List<String> endNodeIds = new ArrayList<>();

        List<NodeDefinition> nodeDefinitions = definition.getNodes() != null ? definition.getNodes() : List.of();
        for (int i = 0; i < nodeDefinitions.size(); i++) {
            NodeDefinition def = nodeDefinitions.get(i);
            if (def.getId() == null || def.getId().isBlank()) {
                errors.add(new ValidationError("nodes[" + i + "].id", "Node id must not be empty"));
                continue;
            }
            if (nodes.containsKey(def.getId()) || conditionNodes.contains(def.getId())) {
                errors.add(new ValidationError("nodes[" + def.getId() + "].id", "Duplicate node id: " + def.getId()));
                continue;
            }
            try {
                WorkflowNode<?> node = factory.create(def);
                if (node == null) {
                    conditionNodes.add(def.getId());
                    continue;
                }
                nodes.put(def.getId(), node);
            } catch (ConfigurationException e) {
                errors.addAll(errorsOf(e, "nodes[" + def.getId() + "]"));
                continue;
            }
            if (def.getNodeType() == NodeType.START) {
                if (startNodeId != null) {
                    errors.add(new ValidationError("nodes[" + def.getId() + "].type", "A workflow must have exactly one start node"));
                } else {
                    startNodeId = def.getId();
                }
            } else if (def.getNodeType() == NodeType.END) {
                endNodeIds.add(def.getId());
            }
        }

        // Failed nodes are left out of the map; only check structure when every node was built
        boolean allNodesBuilt = errors.isEmpty();
        if (startNodeId == null && allNodesBuilt) {
            errors.add(new ValidationError("nodes", "A workflow must have a start node"));
        }
        if (endNodeIds.isEmpty() && allNodesBuilt) {
            errors.add(new ValidationError("nodes", "A workflow must have at least one end node"));
        }

        List<Edge> edges = buildEdges(definition, nodes, conditionNodes, allNodesBuilt, errors);
        validateConversationVariables(definition, errors);
        if (errors.isEmpty() && hasCycle(nodes.keySet(), edges)) {
            errors.add(new ValidationError("edges", "Workflow graph contains a cycle"));
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        WorkflowGraph graph = new WorkflowGraph(nodes, edges, startNodeId, endNodeIds);
        graph.warnUnreachable();
        return graph;
    }

    private static List<Edge> buildEdges(WorkflowDefinition definition,
                                         Map<String, WorkflowNode<?>> nodes,
                                         Set<String> conditionNodes,
                                         boolean checkReferences,
                                         List<ValidationError> errors) {
        List<Edge> edges = new ArrayList<>();
        Map<String, Integer> unlabeledCount = new HashMap<>();
        List<EdgeDefinition> edgeDefinitions = definition.getEdges() != null ? definition.getEdges() : List.of();

        for (int i = 0; i < edgeDefinitions.size(); i++) {
            EdgeDefinition def = edgeDefinitions.get(i);
            String field = "edges[" + (def.getId() != null ? def.getId() : String.valueOf(i)) + "]";
            if (conditionNodes.contains(def.getSource()) || conditionNodes.contains(def.getTarget())) {
                log.debug("Ignoring {} attached to a condition node", field);
                continue;
            }
            WorkflowNode<?> source = nodes.get(def.getSource());
            WorkflowNode<?> target = nodes.get(def.getTarget());
            if (source == null || target == null) {
                if (checkReferences) {
                    errors.add(new ValidationError(field, "Edge references an unknown node: "
                            + (source == null ? def.getSource() : def.getTarget())));
                }
                continue;
            }
            if (target.getType() == NodeType.START) {
                errors.add(new ValidationError(field, "The start node cannot have incoming edges"));
                continue;
            }
            if (source.getType() == NodeType.END) {
                errors.add(new ValidationError(field, "End nodes cannot have outgoing edges"));
                continue;
            }

            String label = def.getLabel() != null && !def.getLabel().isBlank() ? def.getLabel().trim() : null;
            if (label == null && !def.isErrorEdge() && source.isRouting()) {
                int index = unlabeledCount.merge(source.getId(), 1, Integer::sum) - 1;
                label = source.defaultEdgeLabel(index);
            }
            edges.add(new Edge(i, def.getSource(), def.getTarget(), label, def.isErrorEdge()));
        }
        return edges;
    }

    private static void validateConversationVariables(WorkflowDefinition definition, List<ValidationError> errors) {
        List<VariableDefinition> variables = definition.getVariables() != null ? definition.getVariables() : List.of();
        List<String> names = variables.stream().map(VariableDefinition::getName).toList();
        ExpressionEvaluator.validateVariableNames(names)
                .forEach(message -> errors.add(new ValidationError("variables", message)));
        if (new HashSet<>(names).size() != names.size()) {
            errors.add(new ValidationError("variables", "Conversation variable names must be unique"));
        }
    }

    private static boolean hasCycle(Set<String> nodeIds, List<Edge> edges) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        nodeIds.forEach(id -> inDegree.put(id, 0));
        for (Edge edge : edges) {
            inDegree.merge(edge.target(), 1, Integer::sum);
            successors.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String next : successors.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) ready.add(next);
            }
        }
        return visited != nodeIds.size();
    }

    private static List<ValidationError> errorsOf(ConfigurationException e, String fallbackField) {
        if (!e.getErrors().isEmpty()) {
            return e.getErrors();
        }
        return List.of(new ValidationError(fallbackField, e.getMessage()));
    }

    private void warnUnreachable() {
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(List.of(startNodeId));
        while (!pending.isEmpty()) {
            String id = pending.poll();
            if (reached.add(id)) {
                outgoing(id).forEach(edge -> pending.add(edge.target()));
            }
        }
        nodes.keySet().stream()
                .filter(id -> !reached.contains(id))
                .forEach(id -> log.warn("Node {} is not reachable from the start node and will never run", id));
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public WorkflowNode<?> node(String id) {
        return nodes.get(id);
    }

    public Map<String, WorkflowNode<?>> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public List<String> getEndNodeIds() {
        return endNodeIds;
    }

    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<Edge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public boolean hasErrorEdge(String nodeId) {
        return outgoing(nodeId).stream().anyMatch(Edge::errorEdge);
    }

    /** Ids of the nodes with an edge into {@code nodeId}. */
    public Set<String> predecessors(String nodeId) {
        Set<String> ids = new LinkedHashSet<>();
        incoming(nodeId).forEach(edge -> ids.add(edge.source()));
        return ids;
    }

    /** Ids of the nodes {@code nodeId} has an edge into. */
    public Set<String> successors(String nodeId) {
        Set<String> ids = new LinkedHashSet<>();
        outgoing(nodeId).forEach(edge -> ids.add(edge.target()));
        return ids;
    }
}
