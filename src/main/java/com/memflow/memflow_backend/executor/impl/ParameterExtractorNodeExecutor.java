package com.memflow.memflow_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.llm.LlmService;
import com.memflow.memflow_backend.model.config.ParameterExtractorNodeConfig;
import com.memflow.memflow_backend.model.config.ParameterExtractorNodeConfig.ParamDefinition;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Config shape:
 * {
 *   "model_id": "3f0c...",
 *   "text": "{{sys.message}}",
 *   "params": [
 *     {"name": "city", "type": "string", "desc": "Destination city", "required": true},
 *     {"name": "nights", "type": "number", "desc": "Number of nights", "required": false}
 *   ],
 *   "prompt": "Dates are always in ISO format."
 * }
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterExtractorNodeExecutor implements NodeExecutor<ParameterExtractorNodeConfig> {

    static final String SYSTEM_PROMPT =
            "You extract structured parameters from text. Return ONLY a valid JSON object whose keys are the "
            + "requested parameter names. Use null for parameters that cannot be found in the text. "
            + "No explanation, no markdown, no code fences.";

    private final LlmService llmService;
    private final ObjectMapper objectMapper;

    @Override
    public NodeType supportedType() {
        return NodeType.PARAMETER_EXTRACTOR;
    }

    @Override
    public Class<ParameterExtractorNodeConfig> configType() {
        return ParameterExtractorNodeConfig.class;
    }

    @Override
    public Object execute(WorkflowNode<ParameterExtractorNodeConfig> node, NodeExecutionContext ctx) {
        ParameterExtractorNodeConfig config = node.getConfig();
        String text = ctx.render(config.getText(), true);

        LlmRequest request = LlmRequest.of(SYSTEM_PROMPT, userPrompt(config, text, ctx));
        request.setJsonOutput(true);
        request.setTemperature(0.0);
        LlmResponse response = llmService.complete(config.getModelId(), request);
        if (!response.isSuccess()) {
            return failure(config, ctx, response.getErrorMessage());
        }
        ctx.recordTokenUsage(response.tokenUsage());

        Map<String, Object> extracted = extractJson(response.getRawText());
        if (extracted == null) {
            return failure(config, ctx, "Model response is not a JSON object: " + truncate(response.getRawText(), 200));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        for (ParamDefinition param : config.getParams()) {
            Object value = coerce(param.getType(), extracted.get(param.getName()));
            if (value == null && param.isRequired()) {
                log.warn("Parameter extractor {} could not extract required parameter '{}'", node.getId(), param.getName());
            }
            output.put(param.getName(), value);
        }
        log.info("Parameter extractor {} extracted {}", node.getId(), output.keySet());
        return output;
    }

    // ── Prompt ───────────────────────────────────────────────────────────────

    private String userPrompt(ParameterExtractorNodeConfig config, String text, NodeExecutionContext ctx) {
        StringBuilder sb = new StringBuilder("Parameters:\n");
        for (ParamDefinition param : config.getParams()) {
            sb.append("- ").append(param.getName())
              .append(" (").append(param.getType()).append(param.isRequired() ? ", required" : "").append(")");
            if (param.getDesc() != null && !param.getDesc().isBlank()) {
                sb.append(": ").append(param.getDesc());
            }
            sb.append('\n');
        }
        if (config.getPrompt() != null && !config.getPrompt().isBlank()) {
            sb.append("\nInstructions:\n").append(ctx.render(config.getPrompt(), false)).append('\n');
        }
        sb.append("\nTEXT:\n").append(text);
        return sb.toString();
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private Map<String, Object> extractJson(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String cleaned = raw.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.replaceAll("^```[a-zA-Z]*\\n?", "").replaceAll("```$", "").trim();
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end < start) return null;
        try {
            return objectMapper.readValue(cleaned.substring(start, end + 1), Map.class);
        } catch (JsonProcessingException e) {
            log.debug("Parameter extractor JSON parse failed: {}", e.getMessage());
            return null;
        }
    }

    /** Converts a JSON value to the declared parameter type; values that do not fit become {@code null}. */
    static Object coerce(String type, Object value) {
        if (value == null) return null;
        if (type.startsWith("array[")) {
            if (!(value instanceof List<?> list)) return null;
            String itemType = type.substring("array[".length(), type.length() - 1);
            if ("object".equals(itemType)) {
                return list.stream().filter(Map.class::isInstance).toList();
            }
            List<Object> items = new ArrayList<>();
            for (Object item : list) {
                Object coerced = coerce(itemType, item);
                if (coerced != null) items.add(coerced);
            }
            return items;
        }
        return switch (type) {
            case "string" -> value instanceof Map<?, ?> || value instanceof List<?> ? null : value.toString();
            case "number" -> toNumber(value);
            case "boolean" -> toBoolean(value);
            default -> value;
        };
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number number) return number;
        if (value instanceof String s) {
            try {
                return s.contains(".") ? Double.parseDouble(s.trim()) : Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) return true;
            if ("false".equalsIgnoreCase(s.trim())) return false;
        }
        return null;
    }

    private static Map<String, Object> failure(ParameterExtractorNodeConfig config, NodeExecutionContext ctx, String error) {
        ctx.recordToolError("llm", error);
        Map<String, Object> output = new LinkedHashMap<>();
        config.getParams().forEach(p -> output.put(p.getName(), null));
        output.put("error", error);
        return output;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "null";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
