package com.memflow.memflow_backend.engine.expression;

public enum UnaryOperator {
    NEGATE,
    PLUS,
    NOT;

    public Object apply(Object operand) {
        return switch (this) {
            case NEGATE -> Values.negate(operand);
            case PLUS -> Values.plus(operand);
            case NOT -> !Values.truthy(operand);
        };
    }
}
