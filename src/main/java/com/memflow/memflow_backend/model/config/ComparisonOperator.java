package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Comparisons available in an if-else condition.
 */
public enum ComparisonOperator {
    EMPTY("empty"),
    NOT_EMPTY("not_empty"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    START_WITH("startwith", "start_with"),
    END_WITH("endwith", "end_with"),
    EQ("eq", "=="),
    NE("ne", "!="),
    LT("lt", "<"),
    LE("le", "<="),
    GT("gt", ">"),
    GE("ge", ">=");

    private final String value;
    private final List<String> aliases;

    ComparisonOperator(String value, String... aliases) {
        this.value = value;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** {@code empty} and {@code not_empty} ignore the right operand. */
    public boolean isUnary() {
        return this == EMPTY || this == NOT_EMPTY;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase();
            for (ComparisonOperator op : values()) {
                if (op.value.equals(v) || op.aliases.contains(v)) return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
