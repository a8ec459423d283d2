package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.engine.expression.Values;
import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.EnumSet;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.ADD;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.ASSIGN;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.CLEAR;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.DIVIDE;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.MULTIPLY;
import static com.memflow.memflow_backend.model.config.AssignmentOperation.SUBTRACT;

/**
 * Integral operands keep exact {@code long} arithmetic; division always yields a {@code double}.
 */
class NumberOperators extends VariableOperators {

    NumberOperators() {
        super(VariableType.NUMBER, EnumSet.of(ASSIGN, CLEAR, ADD, SUBTRACT, MULTIPLY, DIVIDE));
    }

    @Override
    protected Object doApply(AssignmentOperation operation, Object current, Object value) {
        return switch (operation) {
            case ASSIGN -> Values.normalize(value);
            case CLEAR -> 0L;
            case ADD -> Values.add(current, value);
            case SUBTRACT -> Values.subtract(current, value);
            case MULTIPLY -> Values.multiply(current, value);
            case DIVIDE -> {
                if (((Number) value).doubleValue() == 0.0d) {
                    throw new OperatorTypeException("Division by zero");
                }
                yield Values.divide(current, value);
            }
            default -> throw new IllegalStateException("Unhandled number operation: " + operation);
        };
    }
}
