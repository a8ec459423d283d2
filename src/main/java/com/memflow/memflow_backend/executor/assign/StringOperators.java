package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.EnumSet;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.ASSIGN;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.CLEAR;

class StringOperators extends VariableOperators {

    StringOperators() {
        super(VariableType.STRING, EnumSet.of(ASSIGN, CLEAR));
    }

    @Override
    protected Object doApply(AssignmentOperation operation, Object current, Object value) {
        return operation == CLEAR ? "" : value;
    }
}
