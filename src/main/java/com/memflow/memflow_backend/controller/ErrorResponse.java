package com.memflow.memflow_backend.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memflow.memflow_backend.exception.ValidationError;

import java.util.List;

/**
 * Error body returned by every failing endpoint. {@code errors} is only present for
 * validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, List.of());
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? errors : List.of());
    }
}
