package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.UndefinedVariableException;

public enum RelationalOperator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    private final String symbol;

    RelationalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(Object left, Object right) {
        return switch (this) {
            case EQ -> Values.looseEquals(left, right);
            case NE -> !Values.looseEquals(left, right);
            case LT -> Values.compare(defined(left), defined(right), symbol) < 0;
            case LE -> Values.compare(defined(left), defined(right), symbol) <= 0;
            case GT -> Values.compare(defined(left), defined(right), symbol) > 0;
            case GE -> Values.compare(defined(left), defined(right), symbol) >= 0;
            case IN -> Values.contains(right, left);
            case NOT_IN -> !Values.contains(right, left);
            case IS -> identical(left, right);
            case IS_NOT -> !identical(left, right);
        };
    }

    private static boolean identical(Object left, Object right) {
        if (left instanceof Undefined) left = null;
        if (right instanceof Undefined) right = null;
        if (left == null || right == null) return left == right;
        if (left instanceof Boolean && right instanceof Boolean) return left.equals(right);
        return left == right;
    }

    private static Object defined(Object value) {
        if (value instanceof Undefined u) {
            throw new UndefinedVariableException(u.getName());
        }
        return value;
    }
}
