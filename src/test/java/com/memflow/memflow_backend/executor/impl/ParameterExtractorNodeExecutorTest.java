package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.executor.NodeFactory;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.llm.LlmService;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;
import com.memflow.memflow_backend.model.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.memflow.memflow_backend.executor.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParameterExtractorNodeExecutorTest {

    @Mock
    private LlmService llmService;

    private NodeFactory factory;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        factory = factory(new ParameterExtractorNodeExecutor(llmService, MAPPER));
        state = state(Map.of("message", "Book 3 nights in Lisbon, breakfast included"), Map.of());
    }

    private WorkflowNode<?> extractor() {
        return factory.create(definition("pe", "parameter-extractor", Map.of(
                "model_id", "gpt",
                "text", "{{sys.message}}",
                "params", List.of(
                        Map.of("name", "city", "type", "string", "required", true),
                        Map.of("name", "nights", "type", "number"),
                        Map.of("name", "breakfast", "type", "boolean"),
                        Map.of("name", "extras", "type", "array[string]")))));
    }

    @Test
    @DisplayName("parses fenced JSON and coerces each parameter to its declared type")
    void extractsTypedParameters() {
        when(llmService.complete(eq("gpt"), any())).thenReturn(LlmResponse.ok(
                "```json\n{\"city\": \"Lisbon\", \"nights\": \"3\", \"breakfast\": \"true\", \"extras\": [\"spa\", 1]}\n```",
                "gpt", 40, 20));

        Object output = extractor().execute(context(state, "pe"));

        assertEquals(Map.of("city", "Lisbon", "nights", 3L, "breakfast", true, "extras", List.of("spa", "1")), output);

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmService).complete(eq("gpt"), request.capture());
        assertTrue(request.getValue().isJsonOutput());
        assertTrue(request.getValue().getUserPrompt().contains("Lisbon"));
    }

    @Test
    @DisplayName("a non-JSON answer yields null parameters and a tool error")
    void nonJsonAnswer() {
        when(llmService.complete(eq("gpt"), any())).thenReturn(LlmResponse.ok("I cannot help with that", "gpt", 1, 1));

        Map<?, ?> output = (Map<?, ?>) extractor().execute(context(state, "pe"));

        assertNull(output.get("city"));
        assertTrue(output.containsKey("nights"));
        assertTrue(output.get("error").toString().startsWith("Model response is not a JSON object"));
        assertEquals("llm", state.getErrors().get(0).tool());
    }

    @Test
    void coercion() {
        assertEquals(2.5, ParameterExtractorNodeExecutor.coerce("number", "2.5"));
        assertNull(ParameterExtractorNodeExecutor.coerce("number", "many"));
        assertNull(ParameterExtractorNodeExecutor.coerce("boolean", "maybe"));
        assertNull(ParameterExtractorNodeExecutor.coerce("string", Map.of()));
        assertNull(ParameterExtractorNodeExecutor.coerce("array[number]", "1,2"));

        Map<String, Object> item = new HashMap<>();
        item.put("k", 1);
        assertEquals(List.of(item), ParameterExtractorNodeExecutor.coerce("array[object]", List.of(item, "x")));
    }
}
