package com.memflow.memflow_backend.executor.branch;

import com.memflow.memflow_backend.engine.expression.Expression;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.engine.expression.RelationalOperator;
import com.memflow.memflow_backend.engine.expression.Values;
import com.memflow.memflow_backend.model.config.ComparisonOperator;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig.ConditionDetail;

import java.util.List;

/**
 * Turns one declarative comparison into an expression tree.
 *
 * <p>Operands given as strings are parsed as expressions, so {@code "{{conv.score}}"},
 * {@code "conv.score"} and {@code "'abc'"} all work; other JSON values become literals.</p>
 */
public class ConditionExpressionBuilder {

    private final ExpressionEvaluator evaluator;

    public ConditionExpressionBuilder(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Expression build(ConditionDetail condition) {
        Expression left = operand(condition.getLeft());
        ComparisonOperator operator = condition.getComparisonOperator();
        if (operator.isUnary()) {
            return new Expression.EmptinessTest(left, operator == ComparisonOperator.NOT_EMPTY);
        }
        Expression right = operand(condition.getRight());
        return switch (operator) {
            // membership reads right-in-left: "left contains right"
            case CONTAINS -> compare(right, RelationalOperator.IN, left);
            case NOT_CONTAINS -> compare(right, RelationalOperator.NOT_IN, left);
            case START_WITH -> new Expression.AffixTest(true, left, right);
            case END_WITH -> new Expression.AffixTest(false, left, right);
            case EQ -> compare(left, RelationalOperator.EQ, right);
            case NE -> compare(left, RelationalOperator.NE, right);
            case LT -> compare(left, RelationalOperator.LT, right);
            case LE -> compare(left, RelationalOperator.LE, right);
            case GT -> compare(left, RelationalOperator.GT, right);
            case GE -> compare(left, RelationalOperator.GE, right);
            case EMPTY, NOT_EMPTY -> throw new IllegalStateException("unreachable");
        };
    }

    Expression operand(Object raw) {
        if (raw instanceof String source) {
            return evaluator.parse(source);
        }
        return new Expression.Literal(Values.normalize(raw));
    }

    private static Expression compare(Expression left, RelationalOperator operator, Expression right) {
        return new Expression.Comparison(left, List.of(operator), List.of(right));
    }
}
