package com.memflow.memflow_backend.exception;

import lombok.Getter;

import java.util.List;

/**
 * Invalid workflow or node configuration. Raised while the graph is built,
 * before any node runs.
 */
@Getter
public class ConfigurationException extends WorkflowException {

    private final List<ValidationError> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of();
    }

    public ConfigurationException(String field, String message) {
        super(message);
        this.errors = List.of(new ValidationError(field, message));
    }

    public ConfigurationException(List<ValidationError> errors) {
        super(summary(errors));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    private static String summary(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) return "Workflow configuration is invalid";
        if (errors.size() == 1) return errors.get(0).field() + ": " + errors.get(0).message();
        return "Workflow configuration is invalid: " + errors.size() + " errors";
    }
}
