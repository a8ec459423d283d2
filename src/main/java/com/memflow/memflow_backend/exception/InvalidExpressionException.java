package com.memflow.memflow_backend.exception;

import lombok.Getter;

/**
 * Syntax error or a construct the sandbox refuses (calls, imports, assignment, lambdas).
 */
@Getter
public class InvalidExpressionException extends EvaluationException {

    private final String expression;
    private final int position;

    public InvalidExpressionException(String message, String expression, int position) {
        super(message + (expression != null ? " at position " + position + " in '" + expression + "'" : ""));
        this.expression = expression;
        this.position = position;
    }
}
