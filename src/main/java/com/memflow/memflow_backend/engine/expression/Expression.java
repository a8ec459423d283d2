package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.UndefinedVariableException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a parsed expression tree. Trees come either from {@link ExpressionParser}
 * or are assembled directly, e.g. by the if-else branch compiler.
 */
public interface Expression {

    Object evaluate(EvaluationScope scope);

    /**
     * Dotted path of a plain reference such as {@code llm.output} or {@code node["llm"].output},
     * or {@code null} when the expression is anything else.
     */
    static List<String> referencePath(Expression expression) {
        Deque<String> segments = new ArrayDeque<>();
        Expression current = expression;
        while (true) {
            if (current instanceof Attribute attribute) {
                segments.addFirst(attribute.name());
                current = attribute.target();
            } else if (current instanceof Subscript subscript
                    && subscript.index() instanceof Literal literal
                    && literal.value() instanceof String key) {
                segments.addFirst(key);
                current = subscript.target();
            } else if (current instanceof Name name) {
                segments.addFirst(name.name());
                return new ArrayList<>(segments);
            } else {
                return null;
            }
        }
    }

    record Literal(Object value) implements Expression {
        public static final Literal TRUE = new Literal(Boolean.TRUE);

        @Override
        public Object evaluate(EvaluationScope scope) {
            return value;
        }
    }

    record Name(String name) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return scope.lookup(name);
        }
    }

    record Attribute(Expression target, String name) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return MemberAccess.attribute(target.evaluate(scope), name, scope.isStrict());
        }
    }

    record Subscript(Expression target, Expression index) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object container = target.evaluate(scope);
            return MemberAccess.index(container, index.evaluate(scope), scope.isStrict());
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return operator.apply(operand.evaluate(scope));
        }
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return operator.apply(left.evaluate(scope), right.evaluate(scope));
        }
    }

    /** Short-circuit {@code and}/{@code or}; yields the deciding operand, not a coerced boolean. */
    record Logical(boolean conjunction, List<Expression> operands) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object last = null;
            for (Expression operand : operands) {
                last = operand.evaluate(scope);
                boolean truthy = Values.truthy(last);
                if (conjunction != truthy) {
                    return last;
                }
            }
            return last;
        }
    }

    /** Chained comparison: {@code a < b < c} means {@code a < b and b < c}. */
    record Comparison(Expression first, List<RelationalOperator> operators, List<Expression> operands)
            implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object left = first.evaluate(scope);
            for (int i = 0; i < operators.size(); i++) {
                Object right = operands.get(i).evaluate(scope);
                if (!operators.get(i).test(left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }
    }

    record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return Values.truthy(condition.evaluate(scope)) ? whenTrue.evaluate(scope) : whenFalse.evaluate(scope);
        }
    }

    record ListLiteral(List<Expression> items) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            List<Object> values = new ArrayList<>(items.size());
            for (Expression item : items) {
                values.add(item.evaluate(scope));
            }
            return values;
        }
    }

    record MapLiteral(List<Expression> keys, List<Expression> values) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                map.put(keys.get(i).evaluate(scope), values.get(i).evaluate(scope));
            }
            return map;
        }
    }

    /** {@code target | name(arguments)}. */
    record Filter(Expression target, String name, List<Expression> arguments) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object value;
            try {
                value = target.evaluate(scope);
            } catch (UndefinedVariableException e) {
                // default() is the one filter that accepts an undefined input in strict mode
                if (!Filters.acceptsUndefined(name)) throw e;
                value = new Undefined(e.getName());
            }
            List<Object> values = new ArrayList<>(arguments.size());
            for (Expression argument : arguments) {
                values.add(argument.evaluate(scope));
            }
            return Filters.apply(name, value, values);
        }
    }

    /** Prefix/suffix test. Not reachable from source text since calls are not part of the grammar. */
    record AffixTest(boolean prefix, Expression subject, Expression affix) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object value = subject.evaluate(scope);
            Object part = affix.evaluate(scope);
            if (!(value instanceof String s) || !(part instanceof String p)) {
                throw new EvaluationException((prefix ? "startwith" : "endwith") + " needs string operands, got "
                        + Values.typeName(value) + " and " + Values.typeName(part));
            }
            return prefix ? s.startsWith(p) : s.endsWith(p);
        }
    }

    /** True for null, undefined, empty strings and empty collections. */
    record EmptinessTest(Expression operand, boolean negated) implements Expression {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object value = operand.evaluate(scope);
            boolean empty = value == null
                    || value instanceof Undefined
                    || (value instanceof String s && s.isEmpty())
                    || (value instanceof List<?> l && l.isEmpty())
                    || (value instanceof Map<?, ?> m && m.isEmpty());
            return negated != empty;
        }
    }
}
