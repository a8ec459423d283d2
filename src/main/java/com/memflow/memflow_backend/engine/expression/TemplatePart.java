package com.memflow.memflow_backend.engine.expression;

import java.util.List;
import java.util.Set;

/**
 * One span of a parsed template: literal text, a {@code {{ expr }}} placeholder, or an
 * {@code if}/{@code for} block holding parts of its own.
 */
public interface TemplatePart {

    record Text(String text) implements TemplatePart {
    }

    record Placeholder(String source, Expression expression) implements TemplatePart {

        private static final Set<String> VARIABLE_NAMESPACES = Set.of("sys", "conv", "var");
        private static final Set<String> NODE_NAMESPACES = Set.of("node", "nodes");

        /**
         * Id of the node this placeholder reads from when it is a plain reference
         * ({@code {{llm.output}}}, {@code {{node.llm.output}}}); {@code null} otherwise.
         */
        public String referencedNodeId() {
            List<String> path = Expression.referencePath(expression);
            if (path == null) return null;
            String root = path.get(0);
            if (VARIABLE_NAMESPACES.contains(root)) return null;
            if (NODE_NAMESPACES.contains(root)) {
                return path.size() > 1 ? path.get(1) : null;
            }
            return root;
        }
    }

    /** One {@code if}/{@code elif} arm. */
    record Branch(Expression condition, List<TemplatePart> body) {
    }

    /** {@code {% if %}...{% elif %}...{% else %}...{% endif %}}. */
    record Conditional(List<Branch> branches, List<TemplatePart> otherwise) implements TemplatePart {
    }

    /**
     * {@code {% for x in items %}...{% else %}...{% endfor %}}. With two targets each item
     * must be a two-element list, as produced by {@code dictsort}.
     */
    record Loop(List<String> targets, Expression iterable, List<TemplatePart> body, List<TemplatePart> otherwise)
            implements TemplatePart {
    }
}
