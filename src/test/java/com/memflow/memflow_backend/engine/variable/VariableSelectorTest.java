package com.memflow.memflow_backend.engine.variable;

import com.memflow.memflow_backend.exception.SelectorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableSelectorTest {

    @ParameterizedTest
    @ValueSource(strings = {"sys.message", "conv.user_name", "llm_qa.output.text", "start", "a.", ".b"})
    @DisplayName("fromString splits on dots and toString joins them back")
    void roundTripsThroughString(String raw) {
        VariableSelector selector = VariableSelector.fromString(raw);

        assertEquals(Arrays.asList(raw.split("\\.", -1)), selector.path());
        assertEquals(raw, selector.toString());
    }

    @Test
    @DisplayName("namespace classification")
    void classifiesNamespaces() {
        assertTrue(VariableSelector.fromString("sys.user_id").isSystem());
        assertTrue(VariableSelector.fromString("conv.count").isConversation());
        VariableSelector node = VariableSelector.of("llm_1", "output");
        assertTrue(node.isNodeOutput());
        assertEquals("llm_1", node.namespace());
        assertEquals("output", node.key());
        assertNull(VariableSelector.of("conv").key());
    }

    @Test
    @DisplayName("empty path is rejected")
    void rejectsEmptyPath() {
        assertThrows(SelectorException.class, () -> new VariableSelector(List.of()));
        assertThrows(SelectorException.class, () -> VariableSelector.fromString(null));
    }

    @Test
    void equalityFollowsPath() {
        assertEquals(VariableSelector.fromString("conv.a"), VariableSelector.of("conv", "a"));
        assertEquals(VariableSelector.fromString("conv.a").hashCode(), VariableSelector.of("conv", "a").hashCode());
        assertNotEquals(VariableSelector.fromString("conv.a"), VariableSelector.of("conv", "b"));
    }
}
