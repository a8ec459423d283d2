package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.UndefinedVariableException;

import java.util.Map;

/**
 * Names visible to an expression. In strict mode an unknown name raises,
 * otherwise it evaluates to {@link Undefined}.
 *
 * <p>Template loops open a child scope whose names shadow the enclosing ones.</p>
 */
public final class EvaluationScope {

    private final Map<String, Object> names;
    private final boolean strict;
    private final EvaluationScope parent;

    public EvaluationScope(Map<String, Object> names, boolean strict) {
        this(names, strict, null);
    }

    private EvaluationScope(Map<String, Object> names, boolean strict, EvaluationScope parent) {
        this.names = names;
        this.strict = strict;
        this.parent = parent;
    }

    public boolean isStrict() {
        return strict;
    }

    public Object lookup(String name) {
        if (names.containsKey(name)) {
            return names.get(name);
        }
        if (parent != null) {
            return parent.lookup(name);
        }
        if (strict) {
            throw new UndefinedVariableException(name);
        }
        return new Undefined(name);
    }

    /** A scope that sees {@code locals} first and this scope's names behind them. */
    EvaluationScope child(Map<String, Object> locals) {
        return new EvaluationScope(locals, strict, this);
    }
}
