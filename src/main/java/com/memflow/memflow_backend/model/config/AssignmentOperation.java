package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AssignmentOperation {
    ASSIGN("assign", true),
    CLEAR("clear", false),
    ADD("add", true),
    SUBTRACT("subtract", true),
    MULTIPLY("multiply", true),
    DIVIDE("divide", true),
    APPEND("append", true),
    EXTEND("extend", true),
    REMOVE_FIRST("remove_first", false),
    REMOVE_LAST("remove_last", false);

    private final String value;
    private final boolean takesValue;

    AssignmentOperation(String value, boolean takesValue) {
        this.value = value;
        this.takesValue = takesValue;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Whether the operation reads a right-hand value. */
    public boolean takesValue() {
        return takesValue;
    }

    @JsonCreator
    public static AssignmentOperation fromValue(String value) {
        if (value != null) {
            for (AssignmentOperation op : values()) {
                if (op.value.equalsIgnoreCase(value.trim())) return op;
            }
        }
        throw new IllegalArgumentException("Unknown assignment operation: " + value);
    }
}
