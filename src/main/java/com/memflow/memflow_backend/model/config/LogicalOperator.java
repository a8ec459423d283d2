package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LogicalOperator {
    AND("and"),
    OR("or");

    private final String value;

    LogicalOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LogicalOperator fromValue(String value) {
        if (value == null) return AND;
        for (LogicalOperator op : values()) {
            if (op.value.equalsIgnoreCase(value.trim())) return op;
        }
        throw new IllegalArgumentException("Unknown logical operator: " + value);
    }
}
