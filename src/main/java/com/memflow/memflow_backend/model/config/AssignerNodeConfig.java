package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.engine.variable.VariableSelector;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/*
 * Config shape:
 * {
 *   "assignments": [
 *     { "variable_selector": "conv.count", "operation": "add", "value": "5" }
 *   ]
 * }
 * A single assignment may also be given inline (variable_selector/operation/value at the top level).
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssignerNodeConfig implements NodeConfig {

    private List<AssignmentItem> assignments = new ArrayList<>();

    private Object variableSelector;
    private AssignmentOperation operation;
    private Object value;

    /** Declared assignments, including the inline single form. */
    @JsonIgnore
    public List<AssignmentItem> allAssignments() {
        List<AssignmentItem> all = new ArrayList<>();
        if (variableSelector != null) {
            all.add(new AssignmentItem(variableSelector, operation, value));
        }
        if (assignments != null) {
            all.addAll(assignments);
        }
        return all;
    }

    @Override
    public void validate() {
        List<AssignmentItem> all = allAssignments();
        if (all.isEmpty()) {
            throw new ConfigurationException("assignments", "Assigner node has no assignments");
        }
        for (int i = 0; i < all.size(); i++) {
            AssignmentItem item = all.get(i);
            String field = "assignments[" + i + "]";
            if (item.getOperation() == null) {
                throw new ConfigurationException(field + ".operation", "Assignment is missing its operation");
            }
            VariableSelector selector = item.selector();
            if (!selector.isConversation() || selector.key() == null) {
                throw new ConfigurationException(field + ".variable_selector",
                        "Only conversation variables (conv.<name>) can be assigned, got: " + selector);
            }
            if (item.getOperation().takesValue() && item.getValue() == null) {
                throw new ConfigurationException(field + ".value",
                        "Operation '" + item.getOperation().getValue() + "' needs a value");
            }
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssignmentItem {

        /** Dotted string or list of segments. */
        private Object variableSelector;
        private AssignmentOperation operation;
        private Object value;

        public VariableSelector selector() {
            if (variableSelector instanceof List<?> segments) {
                return new VariableSelector(segments.stream().map(String::valueOf).toList());
            }
            if (variableSelector instanceof String s) {
                return VariableSelector.fromString(s.replace("{{", "").replace("}}", "").trim());
            }
            throw new ConfigurationException("variable_selector", "Assignment is missing its variable selector");
        }
    }
}
