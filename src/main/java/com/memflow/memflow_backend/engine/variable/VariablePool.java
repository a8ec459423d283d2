package com.memflow.memflow_backend.engine.variable;

import com.memflow.memflow_backend.exception.SelectorException;
import com.memflow.memflow_backend.model.state.WorkflowState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Read/write view over the variables of a {@link WorkflowState}.
 *
 * <p>Nothing is cached: every call goes to the live state, so two pools over the same state
 * see each other's writes immediately. Writes are only accepted for {@code conv.<key>}.</p>
 */
public class VariablePool {

    private static final Object NO_DEFAULT = new Object();

    private final WorkflowState state;
    private final BooleanSupplier writable;

    public VariablePool(WorkflowState state) {
        this(state, () -> true);
    }

    private VariablePool(WorkflowState state, BooleanSupplier writable) {
        this.state = state;
        this.writable = writable;
    }

    /**
     * A pool over the same state whose writes are rejected once {@code condition} turns false.
     * Reads are unaffected.
     */
    public VariablePool writableWhile(BooleanSupplier condition) {
        return new VariablePool(state, () -> writable.getAsBoolean() && condition.getAsBoolean());
    }

    public WorkflowState getState() {
        return state;
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /**
     * Resolves the selector. {@code sys}/{@code conv} entries that do not exist resolve to
     * {@code null}; a missing node output or nested field raises {@link SelectorException}.
     */
    public Object get(VariableSelector selector) {
        return resolve(selector, NO_DEFAULT);
    }

    /** Same as {@link #get(VariableSelector)} but returns {@code defaultValue} instead of raising. */
    public Object get(VariableSelector selector, Object defaultValue) {
        return resolve(selector, defaultValue);
    }

    public Object get(String selector) {
        return get(VariableSelector.fromString(selector));
    }

    public Object get(String selector, Object defaultValue) {
        return get(VariableSelector.fromString(selector), defaultValue);
    }

    public Object get(List<String> path) {
        return get(new VariableSelector(path));
    }

    public boolean has(VariableSelector selector) {
        if (!selector.isNodeOutput() && selector.path().size() == 2) {
            return namespace(selector.namespace()).containsKey(selector.key());
        }
        try {
            get(selector);
            return true;
        } catch (SelectorException e) {
            return false;
        }
    }

    public boolean has(String selector) {
        return has(VariableSelector.fromString(selector));
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    public void set(VariableSelector selector, Object value) {
        if (!selector.isConversation()) {
            throw new SelectorException("Only conversation variables can be modified, got: " + selector);
        }
        if (selector.key() == null) {
            throw new SelectorException("Selector must name a conversation variable: " + selector);
        }
        if (selector.path().size() > 2) {
            throw new SelectorException("Nested writes are not supported: " + selector);
        }
        if (!writable.getAsBoolean()) {
            throw new SelectorException("Write to " + selector + " rejected: the node is no longer running");
        }
        namespace(WorkflowState.CONV).put(selector.key(), value);
    }

    public void set(String selector, Object value) {
        set(VariableSelector.fromString(selector), value);
    }

    public void set(List<String> path, Object value) {
        set(new VariableSelector(path), value);
    }

    // ── Bulk accessors ───────────────────────────────────────────────────────

    public Map<String, Object> getAllSystemVars() {
        return namespace(WorkflowState.SYS);
    }

    public Map<String, Object> getAllConversationVars() {
        return namespace(WorkflowState.CONV);
    }

    public Map<String, Object> getAllNodeOutputs() {
        return state.getRuntimeVars();
    }

    public Object getNodeOutput(String nodeId) {
        return state.getRuntimeVars().get(nodeId);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("system", getAllSystemVars());
        snapshot.put("conversation", getAllConversationVars());
        snapshot.put("nodes", getAllNodeOutputs());
        return snapshot;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private Map<String, Object> namespace(String name) {
        Object scope = state.getVariables().get(name);
        if (scope instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        state.getVariables().put(name, created);
        return created;
    }

    private Object resolve(VariableSelector selector, Object defaultValue) {
        if (!selector.isNodeOutput()) {
            Map<String, Object> scope = namespace(selector.namespace());
            if (selector.key() == null) {
                return scope;
            }
            if (!scope.containsKey(selector.key())) {
                if (selector.path().size() > 2) {
                    return missing(selector, defaultValue, "key '" + selector.key() + "' does not exist");
                }
                return defaultValue == NO_DEFAULT ? null : defaultValue;
            }
            return walk(scope.get(selector.key()), selector, 2, defaultValue);
        }

        Map<String, Object> outputs = state.getRuntimeVars();
        if (!outputs.containsKey(selector.namespace())) {
            return missing(selector, defaultValue, "node '" + selector.namespace() + "' has no output");
        }
        return walk(outputs.get(selector.namespace()), selector, 1, defaultValue);
    }

    private Object walk(Object current, VariableSelector selector, int from, Object defaultValue) {
        List<String> path = selector.path();
        for (int i = from; i < path.size(); i++) {
            String segment = path.get(i);
            if (!(current instanceof Map<?, ?> map)) {
                return missing(selector, defaultValue, "'" + segment + "' is accessed on a non-mapping value");
            }
            if (!map.containsKey(segment)) {
                return missing(selector, defaultValue, "key '" + segment + "' does not exist");
            }
            current = map.get(segment);
        }
        return current;
    }

    private static Object missing(VariableSelector selector, Object defaultValue, String reason) {
        if (defaultValue != NO_DEFAULT) {
            return defaultValue;
        }
        throw new SelectorException("Variable not found: " + selector + " (" + reason + ")");
    }
}
