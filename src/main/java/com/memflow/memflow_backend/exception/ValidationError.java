package com.memflow.memflow_backend.exception;

/**
 * One problem found while validating a workflow definition or request.
 *
 * @param field   path of the offending field, e.g. {@code nodes[if_1].cases[0].conditions}
 * @param message human-readable description
 */
public record ValidationError(String field, String message) {
}
