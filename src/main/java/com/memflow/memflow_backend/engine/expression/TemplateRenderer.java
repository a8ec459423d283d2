package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.InvalidExpressionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders free text containing {@code {{ expr }}} placeholders.
 *
 * <p>Namespaces: {@code conv} (also {@code var}), {@code node}/{@code nodes} and {@code sys}.
 * Node outputs and conversation variables are merged into the top level as well, so
 * {@code {{llm_qa.output}}} works without a prefix.</p>
 *
 * <p>Strict rendering raises on undefined names; lenient rendering turns them into empty text.
 * Besides placeholders the syntax has {@code {% if %}}/{@code {% elif %}}/{@code {% else %}}
 * and {@code {% for %}} blocks, {@code {# #}} comments, whitespace control with {@code -} and
 * the filters of {@link Filters}. Inside a loop {@code loop.index}, {@code loop.index0},
 * {@code loop.first}, {@code loop.last} and {@code loop.length} describe the iteration.</p>
 */
@Component
public class TemplateRenderer {

    public String render(String template,
                         Map<String, Object> variables,
                         Map<String, Object> nodeOutputs,
                         Map<String, Object> systemVars,
                         boolean strict) {
        if (template == null || template.isEmpty()) return "";
        return render(parse(template), scope(variables, nodeOutputs, systemVars, strict));
    }

    public String render(List<TemplatePart> parts, EvaluationScope scope) {
        StringBuilder sb = new StringBuilder();
        for (TemplatePart part : parts) {
            sb.append(renderPart(part, scope));
        }
        return sb.toString();
    }

    public String renderPart(TemplatePart part, EvaluationScope scope) {
        if (part instanceof TemplatePart.Text text) {
            return text.text();
        }
        if (part instanceof TemplatePart.Conditional conditional) {
            for (TemplatePart.Branch branch : conditional.branches()) {
                if (Values.truthy(branch.condition().evaluate(scope))) {
                    return render(branch.body(), scope);
                }
            }
            return render(conditional.otherwise(), scope);
        }
        if (part instanceof TemplatePart.Loop loop) {
            return renderLoop(loop, scope);
        }
        TemplatePart.Placeholder placeholder = (TemplatePart.Placeholder) part;
        try {
            return Values.stringify(placeholder.expression().evaluate(scope));
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Failed to render '{{" + placeholder.source() + "}}': " + e.getMessage(), e);
        }
    }

    private String renderLoop(TemplatePart.Loop loop, EvaluationScope scope) {
        Object iterable = loop.iterable().evaluate(scope);
        if (iterable == null) {
            throw new EvaluationException("Cannot iterate over null");
        }
        List<Object> items = Filters.items(iterable, "for");
        if (items.isEmpty()) {
            return render(loop.otherwise(), scope);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> locals = new HashMap<>();
            bindTargets(loop.targets(), items.get(i), locals);
            locals.put("loop", loopInfo(i, items.size()));
            sb.append(render(loop.body(), scope.child(locals)));
        }
        return sb.toString();
    }

    private static void bindTargets(List<String> targets, Object item, Map<String, Object> locals) {
        if (targets.size() == 1) {
            locals.put(targets.get(0), item);
            return;
        }
        if (!(item instanceof List<?> pair) || pair.size() != targets.size()) {
            throw new EvaluationException("Cannot unpack " + Values.typeName(item) + " into "
                    + String.join(", ", targets));
        }
        for (int i = 0; i < targets.size(); i++) {
            locals.put(targets.get(i), pair.get(i));
        }
    }

    private static Map<String, Object> loopInfo(int position, int length) {
        Map<String, Object> info = new HashMap<>();
        info.put("index", (long) position + 1);
        info.put("index0", (long) position);
        info.put("revindex", (long) (length - position));
        info.put("first", position == 0);
        info.put("last", position == length - 1);
        info.put("length", (long) length);
        return info;
    }

    /** Splits a template into text spans, placeholders and blocks, in order. */
    public List<TemplatePart> parse(String template) {
        if (template == null) return new ArrayList<>();
        return new TemplateParser(template).parse();
    }

    /** Syntax check only; nothing is evaluated. An empty list means the template is valid. */
    public List<String> validate(String template) {
        List<String> errors = new ArrayList<>();
        try {
            parse(template);
        } catch (InvalidExpressionException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    /**
     * Builds the render scope. {@code variables} holds conversation variables; nested
     * {@code conv}/{@code sys} maps inside it are unpacked into their namespaces.
     */
    @SuppressWarnings("unchecked")
    public EvaluationScope scope(Map<String, Object> variables,
                                 Map<String, Object> nodeOutputs,
                                 Map<String, Object> systemVars,
                                 boolean strict) {
        Map<String, Object> conv = new LinkedHashMap<>();
        Map<String, Object> sys = new LinkedHashMap<>();
        if (systemVars != null) sys.putAll(systemVars);
        if (variables != null) {
            variables.forEach((key, value) -> {
                if ("sys".equals(key) && value instanceof Map<?, ?> nested) {
                    sys.putAll((Map<String, Object>) nested);
                } else if ("conv".equals(key) && value instanceof Map<?, ?> nested) {
                    conv.putAll((Map<String, Object>) nested);
                } else {
                    conv.put(key, value);
                }
            });
        }
        Map<String, Object> nodes = nodeOutputs != null ? nodeOutputs : Map.of();

        Map<String, Object> names = new HashMap<>(nodes);
        names.putAll(conv);
        names.put("conv", conv);
        names.put("var", conv);
        names.put("node", nodes);
        names.put("nodes", nodes);
        names.put("sys", sys);
        return new EvaluationScope(names, strict);
    }
}
