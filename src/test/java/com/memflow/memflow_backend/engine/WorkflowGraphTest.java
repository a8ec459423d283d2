package com.memflow.memflow_backend.engine;

import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.executor.EndNodeExecutor;
import com.memflow.memflow_backend.executor.IfElseNodeExecutor;
import com.memflow.memflow_backend.executor.NodeFactory;
import com.memflow.memflow_backend.executor.StartNodeExecutor;
import com.memflow.memflow_backend.executor.TransformNodeExecutor;
import com.memflow.memflow_backend.model.workflow.EdgeDefinition;
import com.memflow.memflow_backend.model.workflow.NodeDefinition;
import com.memflow.memflow_backend.model.workflow.VariableDefinition;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphTest {

    private final NodeFactory factory = factory(
            new StartNodeExecutor(),
            new EndNodeExecutor(RENDERER, "Workflow completed"),
            new IfElseNodeExecutor(EVALUATOR),
            new TransformNodeExecutor(RENDERER));

    private static NodeDefinition start() {
        return definition("start", "start", Map.of());
    }

    private static NodeDefinition end(String id) {
        return definition(id, "end", Map.of("output", "done"));
    }

    private static NodeDefinition transform(String id) {
        return definition(id, "transform", Map.of("output", Map.of("value", "x")));
    }

    private static WorkflowDefinition workflow(List<NodeDefinition> nodes, List<EdgeDefinition> edges) {
        WorkflowDefinition definition = new WorkflowDefinition();
        definition.setNodes(new ArrayList<>(nodes));
        definition.setEdges(new ArrayList<>(edges));
        return definition;
    }

    private List<ValidationError> errorsOf(WorkflowDefinition definition) {
        return assertThrows(ConfigurationException.class, () -> WorkflowGraph.build(definition, factory)).getErrors();
    }

    @Test
    @DisplayName("unlabeled edges out of a routing node get CASE labels in definition order")
    void defaultRoutingLabels() {
        NodeDefinition ifElse = definition("if_1", "if-else", Map.of("cases", List.of(Map.of(
                "conditions", List.of(Map.of("left", "{{conv.score}}", "comparison_operator", ">", "right", 1))))));
        WorkflowGraph graph = WorkflowGraph.build(workflow(
                List.of(start(), ifElse, end("end_a"), end("end_b")),
                List.of(EdgeDefinition.of("start", "if_1"),
                        EdgeDefinition.of("if_1", "end_a"),
                        EdgeDefinition.of("if_1", "end_b"))), factory);

        assertEquals("start", graph.getStartNodeId());
        assertEquals(List.of("end_a", "end_b"), graph.getEndNodeIds());
        assertEquals(List.of("CASE1", "CASE2"), graph.outgoing("if_1").stream().map(WorkflowGraph.Edge::label).toList());
        assertNull(graph.outgoing("start").get(0).label());
        assertEquals(Set.of("if_1"), graph.predecessors("end_b"));
    }

    @Test
    void conditionNodesAndTheirEdgesAreDropped() {
        WorkflowGraph graph = WorkflowGraph.build(workflow(
                List.of(start(), definition("cond", "condition", Map.of()), end("end")),
                List.of(EdgeDefinition.of("start", "end"), EdgeDefinition.of("start", "cond"))), factory);

        assertNull(graph.node("cond"));
        assertEquals(1, graph.getEdges().size());
    }

    @Test
    void errorEdgesAreKeptUnlabeled() {
        WorkflowGraph graph = WorkflowGraph.build(workflow(
                List.of(start(), transform("t"), end("end"), end("fallback")),
                List.of(EdgeDefinition.of("start", "t"), EdgeDefinition.of("t", "end"),
                        EdgeDefinition.error("t", "fallback"))), factory);

        assertTrue(graph.hasErrorEdge("t"));
        assertFalse(graph.hasErrorEdge("start"));
    }

    @Nested
    @DisplayName("rejected definitions")
    class Rejected {

        @Test
        void needsStartAndEnd() {
            List<ValidationError> errors = errorsOf(workflow(List.of(transform("t")), List.of()));

            assertEquals(List.of(
                    new ValidationError("nodes", "A workflow must have a start node"),
                    new ValidationError("nodes", "A workflow must have at least one end node")), errors);
        }

        @Test
        void duplicateIdsAndUnknownTypesAreAllReported() {
            List<ValidationError> errors = errorsOf(workflow(
                    List.of(start(), end("end"), end("end"), definition("x", "teleport", Map.of())),
                    List.of()));

            assertEquals(2, errors.size());
            assertEquals("nodes[end].id", errors.get(0).field());
            assertEquals("nodes[x].type", errors.get(1).field());
        }

        @Test
        void edgeToUnknownNode() {
            List<ValidationError> errors = errorsOf(workflow(
                    List.of(start(), end("end")),
                    List.of(EdgeDefinition.of("start", "end"), EdgeDefinition.of("start", "ghost"))));

            assertEquals(List.of(new ValidationError("edges[1]", "Edge references an unknown node: ghost")), errors);
        }

        @Test
        void edgesIntoStartOrOutOfEnd() {
            List<ValidationError> errors = errorsOf(workflow(
                    List.of(start(), transform("t"), end("end")),
                    List.of(EdgeDefinition.of("start", "t"), EdgeDefinition.of("t", "start"),
                            EdgeDefinition.of("t", "end"), EdgeDefinition.of("end", "t"))));

            assertEquals(List.of("edges[1]", "edges[3]"), errors.stream().map(ValidationError::field).toList());
        }

        @Test
        void cycle() {
            List<ValidationError> errors = errorsOf(workflow(
                    List.of(start(), transform("a"), transform("b"), end("end")),
                    List.of(EdgeDefinition.of("start", "a"), EdgeDefinition.of("a", "b"),
                            EdgeDefinition.of("b", "a"), EdgeDefinition.of("b", "end"))));

            assertEquals(List.of(new ValidationError("edges", "Workflow graph contains a cycle")), errors);
        }

        @Test
        void reservedConversationVariableName() {
            WorkflowDefinition definition = workflow(List.of(start(), end("end")), List.of(EdgeDefinition.of("start", "end")));
            definition.setVariables(List.of(new VariableDefinition("sys", "string", false, null, null)));

            List<ValidationError> errors = errorsOf(definition);

            assertEquals("variables", errors.get(0).field());
            assertTrue(errors.get(0).message().contains("reserved"));
        }
    }
}
