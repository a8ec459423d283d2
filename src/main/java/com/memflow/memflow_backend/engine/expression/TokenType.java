package com.memflow.memflow_backend.engine.expression;

enum TokenType {
    NUMBER,
    STRING,
    NAME,
    OPERATOR,
    END
}
