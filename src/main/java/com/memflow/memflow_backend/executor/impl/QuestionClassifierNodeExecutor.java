package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.branch.BranchCompiler;
import com.memflow.memflow_backend.executor.llm.LlmService;
import com.memflow.memflow_backend.model.config.QuestionClassifierNodeConfig;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the model which category a question belongs to and routes like an if-else node:
 * the n-th category (1-based) selects {@code CASEn}. Answers that match no category fall
 * back to the first one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionClassifierNodeExecutor implements NodeExecutor<QuestionClassifierNodeConfig> {

    static final String SYSTEM_PROMPT =
            "You are a text classification engine. Classify the user's question into exactly one of the "
            + "given categories. Reply with the category name only, without quotes or explanation.";

    private final LlmService llmService;

    @Override
    public NodeType supportedType() {
        return NodeType.QUESTION_CLASSIFIER;
    }

    @Override
    public Class<QuestionClassifierNodeConfig> configType() {
        return QuestionClassifierNodeConfig.class;
    }

    @Override
    public Object execute(WorkflowNode<QuestionClassifierNodeConfig> node, NodeExecutionContext ctx) {
        QuestionClassifierNodeConfig config = node.getConfig();
        List<String> categories = config.getCategories().stream()
                .map(QuestionClassifierNodeConfig.Category::getClassName)
                .toList();

        String question = ctx.render(config.getInputVariable(), false);
        if (question.isBlank()) {
            log.warn("Question classifier {} got an empty question, using '{}'", node.getId(), categories.get(0));
            return result(config, categories, 0);
        }

        LlmRequest request = LlmRequest.of(SYSTEM_PROMPT, userPrompt(config, categories, question, ctx));
        request.setTemperature(0.0);
        LlmResponse response = llmService.complete(config.getModelId(), request);
        if (!response.isSuccess()) {
            ctx.recordToolError("llm", response.getErrorMessage());
            Map<String, Object> output = result(config, categories, 0);
            output.put("error", response.getErrorMessage());
            return output;
        }
        ctx.recordTokenUsage(response.tokenUsage());

        int index = match(categories, response.getRawText());
        if (index < 0) {
            log.warn("Question classifier {} got unknown category '{}', using '{}'",
                    node.getId(), response.getRawText(), categories.get(0));
            index = 0;
        }
        log.info("Question classifier {} classified as '{}'", node.getId(), categories.get(index));
        return result(config, categories, index);
    }

    @Override
    public boolean isRouting(QuestionClassifierNodeConfig config) {
        return true;
    }

    @Override
    public String routingLabel(QuestionClassifierNodeConfig config, Object output) {
        return output instanceof Map<?, ?> map && map.get("output") != null ? map.get("output").toString() : null;
    }

    @Override
    public String defaultEdgeLabel(QuestionClassifierNodeConfig config, int index) {
        return BranchCompiler.label(index);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String userPrompt(QuestionClassifierNodeConfig config, List<String> categories,
                                     String question, NodeExecutionContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("Question: ").append(question).append('\n');
        sb.append("Categories: ").append(String.join(", ", categories)).append('\n');
        String supplement = config.getUserSupplementPrompt();
        if (supplement != null && !supplement.isBlank()) {
            sb.append("Additional instructions: ").append(ctx.render(supplement, false)).append('\n');
        }
        sb.append("Category:");
        return sb.toString();
    }

    /** Index of the category named by {@code answer}, ignoring case, quotes and surrounding blanks. */
    static int match(List<String> categories, String answer) {
        if (answer == null) return -1;
        String cleaned = answer.trim().replaceAll("^[\"'`]+|[\"'`.]+$", "").trim();
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i).equalsIgnoreCase(cleaned)) return i;
        }
        return -1;
    }

    private static Map<String, Object> result(QuestionClassifierNodeConfig config, List<String> categories, int index) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put(config.getOutputVariable(), categories.get(index));
        output.put("output", BranchCompiler.label(index));
        return output;
    }
}
