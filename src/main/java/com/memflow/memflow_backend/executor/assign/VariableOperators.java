package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.engine.expression.Values;
import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.config.AssignmentOperation;

import java.util.Set;

/**
 * Operators of one variable type. Subclasses only see operands that already passed the
 * type checks.
 */
public abstract class VariableOperators {

    private final VariableType type;
    private final Set<AssignmentOperation> supported;

    protected VariableOperators(VariableType type, Set<AssignmentOperation> supported) {
        this.type = type;
        this.supported = supported;
    }

    public VariableType type() {
        return type;
    }

    public boolean supports(AssignmentOperation operation) {
        return supported.contains(operation);
    }

    /** Returns the new value of the slot; the caller writes it back. */
    public Object apply(AssignmentOperation operation, Object current, Object value) {
        if (VariableType.of(current) != type) {
            throw new OperatorTypeException("Expected a " + type.displayName() + " variable, got "
                    + Values.typeName(current));
        }
        if (!supports(operation)) {
            throw new OperatorTypeException("Operation '" + operation.getValue() + "' is not supported on "
                    + type.displayName() + " variables");
        }
        if (operation.takesValue()) {
            checkValue(operation, value);
        }
        return doApply(operation, current, value);
    }

    /** Right-hand value check; by default it must have the variable's own type. */
    protected void checkValue(AssignmentOperation operation, Object value) {
        if (VariableType.of(value) != type) {
            throw new OperatorTypeException("Operation '" + operation.getValue() + "' on a " + type.displayName()
                    + " variable needs a " + type.displayName() + " value, got " + Values.typeName(value));
        }
    }

    protected abstract Object doApply(AssignmentOperation operation, Object current, Object value);
}
