package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.EnumSet;
import java.util.LinkedHashMap;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.ASSIGN;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.CLEAR;

class ObjectOperators extends VariableOperators {

    ObjectOperators() {
        super(VariableType.OBJECT, EnumSet.of(ASSIGN, CLEAR));
    }

    @Override
    protected Object doApply(AssignmentOperation operation, Object current, Object value) {
        return operation == CLEAR ? new LinkedHashMap<String, Object>() : value;
    }
}
