package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.engine.expression.TemplateRenderer;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.llm.LlmService;
import com.memflow.memflow_backend.model.config.LlmNodeConfig;
import com.memflow.memflow_backend.model.config.MessageConfig;
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

/**
 * Chat completion against a stored model. Streams the answer token by token when the
 * run is streaming.
 *
 * <pre>
 * {
 *   "model_id": "3f0c...",
 *   "messages": [
 *     {"role": "system", "content": "You are a helpful assistant."},
 *     {"role": "user",   "content": "{{sys.message}}"}
 *   ],
 *   "temperature": 0.7,
 *   "max_tokens": 1024
 * }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmNodeExecutor implements NodeExecutor<LlmNodeConfig> {

    private final LlmService llmService;
    private final TemplateRenderer renderer;

    @Override
    public NodeType supportedType() {
        return NodeType.LLM;
    }

    @Override
    public Class<LlmNodeConfig> configType() {
        return LlmNodeConfig.class;
    }

    @Override
    public void validate(LlmNodeConfig config) {
        config.validate();
        checkTemplate("prompt", config.getPrompt());
        List<MessageConfig> messages = config.getMessages();
        for (int i = 0; messages != null && i < messages.size(); i++) {
            checkTemplate("messages[" + i + "].content", messages.get(i).getContent());
        }
    }

    @Override
    public Object execute(WorkflowNode<LlmNodeConfig> node, NodeExecutionContext ctx) {
        LlmNodeConfig config = node.getConfig();

        LlmRequest request = new LlmRequest();
        request.setMessages(buildMessages(config, ctx));
        request.setTemperature(config.getTemperature());
        request.setMaxTokens(config.getMaxTokens());

        LlmResponse response = ctx.isStreaming()
                ? llmService.invoke(config.getModelId(), request, ctx::emitChunk)
                : llmService.complete(config.getModelId(), request);

        Map<String, Object> output = new LinkedHashMap<>();
        if (!response.isSuccess()) {
            ctx.recordToolError("llm", response.getErrorMessage());
            output.put("output", "");
            output.put("error", response.getErrorMessage());
            return output;
        }

        ctx.recordTokenUsage(response.tokenUsage());
        log.info("LLM node {} completed. Tokens: {}in/{}out. Model: {}",
                node.getId(), response.getInputTokens(), response.getOutputTokens(), response.getModel());
        output.put("output", response.getRawText() != null ? response.getRawText() : "");
        return output;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    private List<Map<String, String>> buildMessages(LlmNodeConfig config, NodeExecutionContext ctx) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (config.getMessages() != null) {
            for (MessageConfig message : config.getMessages()) {
                String content = message.getContent() != null ? ctx.render(message.getContent(), true) : "";
                messages.add(Map.of("role", message.getRole().toLowerCase(), "content", content));
            }
        }
        if (config.getPrompt() != null && !config.getPrompt().isBlank()) {
            messages.add(Map.of("role", "user", "content", ctx.render(config.getPrompt(), true)));
        }
        return messages;
    }

    private void checkTemplate(String field, String template) {
        if (template == null) return;
        List<String> errors = renderer.validate(template);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(field, errors.get(0));
        }
    }
}
