package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.engine.expression.Values;
import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the operator family from the type of the variable's current value and applies
 * the operation. An empty slot (current value {@code null}) takes any value through
 * {@code assign} and rejects every other operation.
 */
public final class AssignmentOperators {

    private static final Map<VariableType, VariableOperators> FAMILIES = new EnumMap<>(VariableType.class);

    static {
        register(new StringOperators());
        register(new NumberOperators());
        register(new BooleanOperators());
        register(new ArrayOperators());
        register(new ObjectOperators());
    }

    private AssignmentOperators() {
    }

    private static void register(VariableOperators operators) {
        FAMILIES.put(operators.type(), operators);
    }

    public static VariableOperators forType(VariableType type) {
        return FAMILIES.get(type);
    }

    /** Returns the new value of the variable. */
    public static Object apply(AssignmentOperation operation, Object current, Object value) {
        VariableType type = VariableType.of(current);
        if (type == null) {
            if (operation != AssignmentOperation.ASSIGN) {
                throw new OperatorTypeException("Operation '" + operation.getValue()
                        + "' needs a typed variable, but the variable has no value yet");
            }
            return Values.normalize(value);
        }
        return forType(type).apply(operation, current, value);
    }
}
