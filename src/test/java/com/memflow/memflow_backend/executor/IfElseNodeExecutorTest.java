package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IfElseNodeExecutorTest {

    private final IfElseNodeExecutor executor = new IfElseNodeExecutor(EVALUATOR);
    private final NodeFactory factory = factory(executor);

    private WorkflowNode<?> node(Map<String, Object> config) {
        return factory.create(definition("if_1", "if-else", config));
    }

    private static Map<String, Object> scoreCase(String operator, Object right) {
        return Map.of("cases", List.of(Map.of(
                "logical_operator", "and",
                "conditions", List.of(Map.of("left", "{{conv.score}}", "comparison_operator", operator, "right", right)))));
    }

    @Test
    @DisplayName("returns the routing label of the selected case")
    void routesToLabel() {
        WorkflowNode<?> node = node(scoreCase(">", 50));
        WorkflowState state = state(Map.of(), Map.of("score", 70L));

        assertEquals("CASE1", node.execute(context(state, "if_1")));
        assertEquals("CASE2", node.execute(context(state(Map.of(), Map.of("score", 10L)), "if_1")));
    }

    @Test
    @DisplayName("cases are compiled when the node is built, not on each execution")
    void compilesOnceAtBuildTime() {
        ExpressionEvaluator compiling = spy(new ExpressionEvaluator());
        NodeFactory spied = factory(new IfElseNodeExecutor(compiling));

        WorkflowNode<?> node = spied.create(definition("if_1", "if-else", scoreCase(">", 50)));
        verify(compiling, atLeastOnce()).parse(anyString());
        clearInvocations(compiling);

        assertEquals("CASE1", node.execute(context(state(Map.of(), Map.of("score", 70L)), "if_1")));
        assertEquals("CASE2", node.execute(context(state(Map.of(), Map.of("score", 10L)), "if_1")));
        verifyNoInteractions(compiling);
        assertEquals(2, node.<List<?>>getPrepared().size());
    }

    @Test
    void isRoutingAndReadsLabelFromStoredOutput() {
        WorkflowNode<?> node = node(scoreCase("gt", 1));

        assertTrue(node.isRouting());
        assertEquals("CASE2", node.routingLabel(Map.of("output", "CASE2")));
        assertEquals("CASE3", node.defaultEdgeLabel(2));
    }

    @Test
    @DisplayName("a case without conditions or with a broken expression is rejected at build time")
    void rejectsInvalidConfig() {
        assertThrows(ConfigurationException.class, () -> node(Map.of("cases", List.of())));
        assertThrows(ConfigurationException.class, () -> node(Map.of("cases", List.of(Map.of("conditions", List.of())))));
        assertThrows(ConfigurationException.class, () -> node(scoreCase("unknown-op", 1)));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> node(Map.of("cases", List.of(Map.of(
                "conditions", List.of(Map.of("left", "os.system('x')", "comparison_operator", "eq", "right", 1)))))));
        assertTrue(ex.getErrors().get(0).field().startsWith("nodes[if_1]"));
    }
}
