package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Jinja-render, transform and variable-aggregator nodes.
 */
class TemplateNodesTest {

    private final NodeFactory factory = factory(
            new JinjaRenderNodeExecutor(RENDERER),
            new TransformNodeExecutor(RENDERER),
            new VariableAggregatorNodeExecutor());

    private WorkflowState state;

    @BeforeEach
    void setUp() {
        state = state(Map.of("user_id", "u-1"), Map.of("name", "Ada"));
        state.getRuntimeVars().put("branch_b", Map.of("output", "from b"));
    }

    @Nested
    @DisplayName("jinja-render")
    class JinjaRender {

        @Test
        void rendersTemplateAgainstMappedNames() {
            WorkflowNode<?> node = factory.create(definition("render", "jinja-render", Map.of(
                    "template", "Hi {{user}} ({{sys.user_id}}), {{missing}}done",
                    "mapping", List.of(Map.of("name", "user", "value", "{{conv.name}}")))));

            assertEquals(Map.of("output", "Hi Ada (u-1), done"), node.execute(context(state, "render")));
        }

        @Test
        @DisplayName("a list mapped from a node output can be looped over and filtered")
        void loopsOverMappedList() {
            state.getRuntimeVars().put("search", Map.of("items", List.of("apples", "pears")));
            WorkflowNode<?> node = factory.create(definition("render", "jinja-render", Map.of(
                    "template", "{% for item in items %}{{ loop.index }}. {{ item | upper }}\n{% endfor %}"
                            + "{{ who | default('anonymous') }} has {{ items | length }}",
                    "mapping", List.of(Map.of("name", "items", "value", "{{search.items}}")))));

            assertEquals(Map.of("output", "1. APPLES\n2. PEARS\nanonymous has 2"),
                    node.execute(context(state, "render")));
        }

        @Test
        void rejectsUnknownFilter() {
            assertThrows(ConfigurationException.class, () -> factory.create(definition("render", "jinja-render", Map.of(
                    "template", "{{ name | shout }}",
                    "mapping", List.of()))));
        }

        @Test
        void rejectsDuplicateMappingNames() {
            assertThrows(ConfigurationException.class, () -> factory.create(definition("render", "jinja-render", Map.of(
                    "template", "x",
                    "mapping", List.of(Map.of("name", "a", "value", "1"), Map.of("name", "a", "value", "2"))))));
        }
    }

    @Nested
    @DisplayName("transform")
    class Transform {

        @Test
        void rendersEachOutputField() {
            WorkflowNode<?> node = factory.create(definition("t", "transform", Map.of(
                    "output", Map.of("greeting", "Hello {{conv.name}}", "echo", "{{branch_b.output}}"))));

            assertEquals(Map.of("greeting", "Hello Ada", "echo", "from b"), node.execute(context(state, "t")));
        }

        @Test
        void needsAtLeastOneField() {
            assertThrows(ConfigurationException.class,
                    () -> factory.create(definition("t", "transform", Map.of("output", Map.of()))));
        }
    }

    @Nested
    @DisplayName("variable-aggregator")
    class Aggregator {

        @Test
        @DisplayName("returns the first selector that resolves, skipping nodes that did not run")
        void flatMode() {
            WorkflowNode<?> node = factory.create(definition("agg", "variable-aggregator", Map.of(
                    "group_variables", List.of("{{branch_a.output}}", "{{branch_b.output}}"))));

            assertEquals("from b", node.execute(context(state, "agg")));
        }

        @Test
        void groupMode() {
            WorkflowNode<?> node = factory.create(definition("agg", "variable-aggregator", Map.of(
                    "group", true,
                    "group_names", List.of("answer", "nothing"),
                    "group_variables", List.of(
                            List.of("branch_a.output", "branch_b.output"),
                            List.of("branch_c.output")))));

            assertEquals(Map.of("answer", "from b", "nothing", ""), node.execute(context(state, "agg")));
        }

        @Test
        void groupShapeIsValidated() {
            assertThrows(ConfigurationException.class, () -> factory.create(definition("agg", "variable-aggregator", Map.of(
                    "group", true,
                    "group_names", List.of("a"),
                    "group_variables", List.of("not-a-list")))));
        }
    }
}
