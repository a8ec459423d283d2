package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.EnumSet;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.ASSIGN;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.CLEAR;

class BooleanOperators extends VariableOperators {

    BooleanOperators() {
        super(VariableType.BOOLEAN, EnumSet.of(ASSIGN, CLEAR));
    }

    @Override
    protected Object doApply(AssignmentOperation operation, Object current, Object value) {
        return operation == CLEAR ? Boolean.FALSE : value;
    }
}
