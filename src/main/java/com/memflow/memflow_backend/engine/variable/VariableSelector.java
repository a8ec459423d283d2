package com.memflow.memflow_backend.engine.variable;

import com.memflow.memflow_backend.exception.SelectorException;
import com.memflow.memflow_backend.model.state.WorkflowState;

import java.util.Arrays;
import java.util.List;

/**
 * Dotted path naming a variable: {@code sys.message}, {@code conv.user_name}, {@code llm_qa.output}.
 * The first segment is the namespace, the second the key. Anything that is not {@code sys} or
 * {@code conv} names a node whose output is walked by the remaining segments.
 */
public final class VariableSelector {

    private final List<String> path;

    public VariableSelector(List<String> path) {
        if (path == null || path.isEmpty()) {
            throw new SelectorException("Variable selector must have at least one segment");
        }
        this.path = List.copyOf(path);
    }

    public static VariableSelector fromString(String selector) {
        if (selector == null) {
            throw new SelectorException("Variable selector must not be null");
        }
        // -1 keeps trailing empty segments so "a." stays two segments
        return new VariableSelector(Arrays.asList(selector.split("\\.", -1)));
    }

    public static VariableSelector of(String... segments) {
        return new VariableSelector(Arrays.asList(segments));
    }

    public List<String> path() {
        return path;
    }

    public String namespace() {
        return path.get(0);
    }

    /** Second segment, or {@code null} for a bare namespace. */
    public String key() {
        return path.size() > 1 ? path.get(1) : null;
    }

    public boolean isSystem() {
        return WorkflowState.SYS.equals(namespace());
    }

    public boolean isConversation() {
        return WorkflowState.CONV.equals(namespace());
    }

    public boolean isNodeOutput() {
        return !isSystem() && !isConversation();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSelector other)) return false;
        return path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", path);
    }
}
