package com.memflow.memflow_backend.engine.expression;

record Token(TokenType type, String text, Object value, int position) {

    boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    boolean isKeyword(String keyword) {
        return is(TokenType.NAME, keyword);
    }
}
