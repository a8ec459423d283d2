package com.memflow.memflow_backend.executor.branch;

import com.memflow.memflow_backend.engine.expression.Expression;

/**
 * One routing branch: its label ({@code CASE1}, ...) and the condition selecting it.
 */
public record CompiledBranch(String label, Expression condition, boolean fallback) {
}
