package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class AssignerNodeExecutorTest {

    private final NodeFactory factory = factory(new AssignerNodeExecutor());

    private WorkflowNode<?> assigner(Map<String, Object> config) {
        return factory.create(definition("assign_1", "assigner", config));
    }

    @Test
    @DisplayName("assignments run in order and see each other's writes")
    void appliesInOrder() {
        WorkflowState state = state(Map.of(), Map.of("count", 0L, "history", List.of()));
        state.getRuntimeVars().put("llm", Map.of("output", "hi"));
        WorkflowNode<?> node = assigner(Map.of("assignments", List.of(
                Map.of("variable_selector", "conv.count", "operation", "add", "value", "5"),
                Map.of("variable_selector", "conv.count", "operation", "multiply", "value", "conv.count"),
                Map.of("variable_selector", List.of("conv", "history"), "operation", "append", "value", "{{llm.output}}"))));

        Object written = node.execute(context(state, "assign_1"));

        Map<String, Object> conv = (Map<String, Object>) state.getVariables().get("conv");
        assertEquals(25L, conv.get("count"));
        assertEquals(List.of("hi"), conv.get("history"));
        assertEquals(Map.of("count", 25L, "history", List.of("hi")), written);
    }

    @Test
    void inlineSingleAssignment() {
        WorkflowState state = state(Map.of(), Map.of());
        WorkflowNode<?> node = assigner(Map.of("variable_selector", "{{conv.topic}}", "operation", "assign", "value", "'billing'"));

        node.execute(context(state, "assign_1"));

        assertEquals("billing", ((Map<?, ?>) state.getVariables().get("conv")).get("topic"));
    }

    @Test
    void typeMismatchRaises() {
        WorkflowState state = state(Map.of(), Map.of("name", "Ada"));
        WorkflowNode<?> node = assigner(Map.of("variable_selector", "conv.name", "operation", "add", "value", 1));

        assertThrows(OperatorTypeException.class, () -> node.execute(context(state, "assign_1")));
    }

    @Test
    void onlyConversationVariablesCanBeTargeted() {
        assertThrows(ConfigurationException.class,
                () -> assigner(Map.of("variable_selector", "sys.user_id", "operation", "assign", "value", "1")));
        assertThrows(ConfigurationException.class,
                () -> assigner(Map.of("variable_selector", "conv.x", "operation", "add")));
        assertThrows(ConfigurationException.class, () -> assigner(Map.of()));
    }
}
