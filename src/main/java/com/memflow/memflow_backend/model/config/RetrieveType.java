package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrieveType {
    PARTICIPLE("participle"),
    SEMANTIC("semantic"),
    HYBRID("hybrid");

    private final String value;

    RetrieveType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RetrieveType fromValue(String value) {
        if (value != null) {
            for (RetrieveType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) return type;
            }
        }
        throw new IllegalArgumentException("Unknown retrieve type: " + value);
    }
}
