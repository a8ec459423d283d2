package com.memflow.memflow_backend.engine.expression;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public Object apply(Object left, Object right) {
        return switch (this) {
            case ADD -> Values.add(left, right);
            case SUBTRACT -> Values.subtract(left, right);
            case MULTIPLY -> Values.multiply(left, right);
            case DIVIDE -> Values.divide(left, right);
            case FLOOR_DIVIDE -> Values.floorDivide(left, right);
            case MODULO -> Values.modulo(left, right);
            case POWER -> Values.power(left, right);
        };
    }
}
