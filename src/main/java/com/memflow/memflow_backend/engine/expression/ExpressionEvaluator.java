package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.InvalidExpressionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates expression strings against the variables of a run.
 *
 * <p>Names visible to an expression:</p>
 * <ul>
 *   <li>{@code var} (alias {@code conv}): conversation variables</li>
 *   <li>{@code node} / {@code nodes}: node outputs keyed by node id</li>
 *   <li>{@code sys}: system variables</li>
 * </ul>
 * Node outputs and conversation variables are also visible unqualified, so {@code score}
 * and {@code var.score} both resolve. On a name clash the conversation variable wins,
 * and the reserved namespaces always win.
 */
@Component
public class ExpressionEvaluator {

    public static final Set<String> RESERVED_NAMESPACES = Set.of("var", "node", "sys", "nodes");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.*?)\\s*}}", Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    public Object evaluate(String expression,
                           Map<String, Object> conversationVars,
                           Map<String, Object> nodeOutputs,
                           Map<String, Object> systemVars) {
        return evaluate(parse(expression), conversationVars, nodeOutputs, systemVars);
    }

    public Object evaluate(Expression expression,
                           Map<String, Object> conversationVars,
                           Map<String, Object> nodeOutputs,
                           Map<String, Object> systemVars) {
        EvaluationScope scope = scope(conversationVars, nodeOutputs, systemVars);
        try {
            return expression.evaluate(scope);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Expression evaluation failed: " + e.getMessage(), e);
        }
    }

    public boolean evaluateBool(String expression,
                                Map<String, Object> conversationVars,
                                Map<String, Object> nodeOutputs,
                                Map<String, Object> systemVars) {
        return Values.truthy(evaluate(expression, conversationVars, nodeOutputs, systemVars));
    }

    public boolean evaluateBool(Expression expression,
                                Map<String, Object> conversationVars,
                                Map<String, Object> nodeOutputs,
                                Map<String, Object> systemVars) {
        return Values.truthy(evaluate(expression, conversationVars, nodeOutputs, systemVars));
    }

    /** Parses without evaluating. {@code {{ }}} delimiters are removed first. */
    public Expression parse(String expression) {
        if (expression == null) {
            throw new InvalidExpressionException("Expression must not be null", null, 0);
        }
        String source = stripDelimiters(expression).trim();
        if (source.isEmpty()) {
            throw new InvalidExpressionException("Expression is empty", expression, 0);
        }
        return new ExpressionParser(source).parse();
    }

    /** Replaces every {@code {{ x }}} with {@code x}, so "{{a}} > {{b}}" becomes "a > b". */
    public static String stripDelimiters(String expression) {
        Matcher matcher = PLACEHOLDER.matcher(expression);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Checks user-declared variable names. Returns one message per offending name;
     * an empty list means every name is usable.
     */
    public static List<String> validateVariableNames(Collection<String> names) {
        List<String> errors = new ArrayList<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                errors.add("Variable name must not be empty");
            } else if (RESERVED_NAMESPACES.contains(name)) {
                errors.add("Variable name '" + name + "' is reserved (reserved names: var, node, sys, nodes)");
            } else if (!IDENTIFIER.matcher(name).matches()) {
                errors.add("Variable name '" + name + "' is not a valid identifier");
            }
        }
        return errors;
    }

    EvaluationScope scope(Map<String, Object> conversationVars,
                          Map<String, Object> nodeOutputs,
                          Map<String, Object> systemVars) {
        Map<String, Object> conv = conversationVars != null ? conversationVars : Map.of();
        Map<String, Object> nodes = nodeOutputs != null ? nodeOutputs : Map.of();
        Map<String, Object> sys = systemVars != null ? systemVars : Map.of();

        Map<String, Object> names = new HashMap<>(nodes);
        names.putAll(conv);
        names.put("var", conv);
        names.put("conv", conv);
        names.put("node", nodes);
        names.put("nodes", nodes);
        names.put("sys", sys);
        return new EvaluationScope(names, true);
    }
}
