package com.memflow.memflow_backend.engine.variable;

import com.memflow.memflow_backend.exception.SelectorException;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class VariablePoolTest {

    private WorkflowState state;
    private VariablePool pool;

    @BeforeEach
    void setUp() {
        state = WorkflowState.create("wf", "exec",
                Map.of("message", "hi", "user_id", "u-1"),
                Map.of("count", 3L));
        pool = new VariablePool(state);
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void readsSystemAndConversationVariables() {
            assertEquals("hi", pool.get("sys.message"));
            assertEquals(3L, pool.get("conv.count"));
        }

        @Test
        @DisplayName("missing sys/conv keys resolve to null")
        void missingNamespaceKeyIsNull() {
            assertNull(pool.get("conv.unknown"));
            assertFalse(pool.has("conv.unknown"));
            assertTrue(pool.has("conv.count"));
        }

        @Test
        @DisplayName("node outputs are walked by nested keys")
        void walksNodeOutputs() {
            state.getRuntimeVars().put("llm", Map.of("output", "answer", "meta", Map.of("tokens", 12)));

            assertEquals("answer", pool.get("llm.output"));
            assertEquals(12, pool.get(List.of("llm", "meta", "tokens")));
            assertEquals("answer", pool.getNodeOutput("llm") instanceof Map<?, ?> m ? m.get("output") : null);
        }

        @Test
        @DisplayName("missing node output raises unless a default is given")
        void missingNodeOutput() {
            assertThrows(SelectorException.class, () -> pool.get("ghost.output"));
            assertEquals("fallback", pool.get("ghost.output", "fallback"));
            assertFalse(pool.has("ghost.output"));
        }

        @Test
        @DisplayName("a nested path under a missing sys/conv key is absent")
        void nestedPathUnderMissingKey() {
            assertFalse(pool.has("conv.missing.deep"));
            assertThrows(SelectorException.class, () -> pool.get("conv.missing.deep"));
            assertEquals("fallback", pool.get("sys.missing.deep", "fallback"));
        }

        @Test
        void accessOnNonMappingRaises() {
            state.getRuntimeVars().put("code", Map.of("output", "text"));

            SelectorException ex = assertThrows(SelectorException.class, () -> pool.get("code.output.length"));
            assertTrue(ex.getMessage().contains("non-mapping"));
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @ParameterizedTest
        @ValueSource(strings = {"sys", "llm_1", "start"})
        @DisplayName("only the conv namespace is writable")
        void rejectsWritesOutsideConv(String namespace) {
            assertThrows(SelectorException.class, () -> pool.set(List.of(namespace, "k"), "v"));
        }

        @Test
        void writeThenReadConversationVariable() {
            pool.set(List.of("conv", "topic"), "billing");

            assertEquals("billing", pool.get(List.of("conv", "topic")));
            assertEquals("billing", pool.getAllConversationVars().get("topic"));
        }

        @Test
        void rejectsNestedAndBareWrites() {
            assertThrows(SelectorException.class, () -> pool.set("conv.a.b", 1));
            assertThrows(SelectorException.class, () -> pool.set("conv", 1));
        }

        @Test
        @DisplayName("two pools over the same state share writes")
        void poolsShareState() {
            VariablePool other = new VariablePool(state);
            other.set("conv.count", 4L);

            assertEquals(4L, pool.get("conv.count"));
        }

        @Test
        @DisplayName("a guarded pool stops writing once its condition turns false")
        void guardedPoolRejectsLateWrites() {
            AtomicBoolean running = new AtomicBoolean(true);
            VariablePool guarded = pool.writableWhile(running::get);

            guarded.set("conv.count", 5L);
            running.set(false);

            assertThrows(SelectorException.class, () -> guarded.set("conv.count", 6L));
            assertEquals(5L, pool.get("conv.count"));
            assertEquals(5L, guarded.get("conv.count"));
            pool.set("conv.count", 7L);
            assertEquals(7L, pool.get("conv.count"));
        }
    }

    @Test
    void snapshotHasAllThreeSections() {
        Map<String, Object> snapshot = pool.toMap();

        assertEquals(List.of("system", "conversation", "nodes"), List.copyOf(snapshot.keySet()));
    }
}
