package com.memflow.memflow_backend.engine.expression;

/**
 * Placeholder produced by lenient rendering for a name or field that does not exist.
 * Renders as an empty string; attribute and index access on it yield another {@code Undefined}.
 */
public final class Undefined {

    private final String name;

    public Undefined(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Undefined child(String segment) {
        return new Undefined(name + "." + segment);
    }

    @Override
    public String toString() {
        return "";
    }
}
