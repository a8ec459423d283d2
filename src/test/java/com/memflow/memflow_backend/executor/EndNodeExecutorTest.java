package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.ExecutionListener;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.model.state.StreamingBuffer;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class EndNodeExecutorTest {

    private static final String TEMPLATE = "{{start.a}}X {{llm.output}} Y";

    private final NodeFactory factory = factory(new EndNodeExecutor(RENDERER, "Workflow completed"));

    private WorkflowState state;
    private final List<String> chunks = new ArrayList<>();
    private final ExecutionListener listener = new ExecutionListener() {
        @Override
        public void chunk(String executionId, String nodeId, String chunk) {
            chunks.add(chunk);
        }
    };

    @BeforeEach
    void setUp() {
        state = state(Map.of(), Map.of());
        state.getRuntimeVars().put("start", Map.of("a", "A"));
        state.getRuntimeVars().put("llm", Map.of("output", "streamed text"));
    }

    private WorkflowNode<?> endNode(String template) {
        return factory.create(definition("end", "end", template != null ? Map.of("output", template) : Map.of()));
    }

    @Test
    @DisplayName("non-streaming run returns the full rendering and emits nothing")
    void rendersWithoutStreaming() {
        Object result = endNode(TEMPLATE).execute(context(state, "end", false, Set.of("llm"), listener));

        assertEquals("AX streamed text Y", result);
        assertTrue(chunks.isEmpty());
    }

    @Test
    void blankTemplateGivesDefaultOutput() {
        Object result = endNode(null).execute(context(state, "end", true, Set.of(), listener));

        assertEquals("Workflow completed", result);
        assertEquals(List.of("Workflow completed"), chunks);
    }

    @Test
    void strictRenderingRaisesOnMissingReference() {
        WorkflowNode<?> node = endNode("{{ghost.output}}");

        assertThrows(EvaluationException.class, () -> node.execute(context(state, "end")));
    }

    @Test
    void invalidTemplateIsRejectedAtBuildTime() {
        assertThrows(ConfigurationException.class, () -> endNode("{{ unclosed"));
    }

    @Nested
    @DisplayName("streaming")
    class Streaming {

        @Test
        @DisplayName("only the suffix after the streamed predecessor is emitted")
        void emitsSuffixOnly() {
            StreamingBuffer buffer = new StreamingBuffer();
            buffer.append("streamed ");
            buffer.append("text");
            state.getStreamingBuffer().put("llm", buffer);
            WorkflowNode<?> node = endNode(TEMPLATE);
            NodeExecutionContext ctx = context(state, "end", true, Set.of("llm"), listener);

            String prefix = node.streamingPrefix("llm", ctx);
            Object full = node.execute(ctx);

            assertEquals("AX ", prefix);
            assertEquals(List.of(" Y"), chunks);
            assertEquals(full, prefix + buffer.getFullContent() + chunks.get(0));
        }

        @Test
        @DisplayName("without an upstream buffer the whole rendering is emitted")
        void emitsFullWhenNothingWasStreamed() {
            Object full = endNode(TEMPLATE).execute(context(state, "end", true, Set.of("llm"), listener));

            assertEquals(List.of(full), chunks);
        }

        @Test
        void noPrefixForNodesThatAreNotTheAnchor() {
            WorkflowNode<?> node = endNode(TEMPLATE);
            NodeExecutionContext ctx = context(state, "end", true, Set.of("llm"), listener);

            assertNull(node.streamingPrefix("start", ctx));
        }
    }
}
