package com.memflow.memflow_backend.exception;

import lombok.Getter;

@Getter
public class UndefinedVariableException extends EvaluationException {

    private final String name;

    public UndefinedVariableException(String name) {
        super("Undefined variable: " + name);
        this.name = name;
    }
}
