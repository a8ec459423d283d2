package com.memflow.memflow_backend.executor.assign;

import java.util.List;
import java.util.Map;

/**
 * Runtime type of a conversation variable, read from its current value.
 */
public enum VariableType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    /** Type of {@code value}; {@code null} for an empty slot. */
    public static VariableType of(Object value) {
        if (value == null) return null;
        if (value instanceof String) return STRING;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof Number) return NUMBER;
        if (value instanceof List<?>) return ARRAY;
        if (value instanceof Map<?, ?>) return OBJECT;
        return OBJECT;
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
