package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.engine.expression.Values;
import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.APPEND;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.ASSIGN;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.CLEAR;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.EXTEND;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.REMOVE_FIRST;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.REMOVE_LAST;

/**
 * Works on a copy; the stored list is replaced, never modified in place.
 */
class ArrayOperators extends VariableOperators {

    ArrayOperators() {
        super(VariableType.ARRAY, EnumSet.of(ASSIGN, CLEAR, APPEND, EXTEND, REMOVE_FIRST, REMOVE_LAST));
    }

    @Override
    protected void checkValue(AssignmentOperation operation, Object value) {
        // append takes a single element of any type
        if (operation == APPEND) {
            if (value == null) {
                throw new OperatorTypeException("append needs a value");
            }
            return;
        }
        super.checkValue(operation, value);
    }

    @Override
    protected Object doApply(AssignmentOperation operation, Object current, Object value) {
        List<Object> items = new ArrayList<>((List<?>) current);
        switch (operation) {
            case ASSIGN -> {
                return new ArrayList<>((List<?>) value);
            }
            case CLEAR -> items.clear();
            case APPEND -> items.add(Values.normalize(value));
            case EXTEND -> items.addAll((List<?>) value);
            case REMOVE_FIRST -> {
                requireNotEmpty(items, operation);
                items.remove(0);
            }
            case REMOVE_LAST -> {
                requireNotEmpty(items, operation);
                items.remove(items.size() - 1);
            }
            default -> throw new IllegalStateException("Unhandled array operation: " + operation);
        }
        return items;
    }

    private static void requireNotEmpty(List<Object> items, AssignmentOperation operation) {
        if (items.isEmpty()) {
            throw new OperatorTypeException("Cannot " + operation.getValue() + " from an empty array");
        }
    }
}
