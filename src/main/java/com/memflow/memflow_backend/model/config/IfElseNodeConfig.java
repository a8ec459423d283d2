package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/*
 * Config shape:
 * {
 *   "cases": [
 *     { "logical_operator": "and",
 *       "conditions": [ { "left": "{{conv.score}}", "comparison_operator": "gt", "right": "60" } ] }
 *   ]
 * }
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IfElseNodeConfig implements NodeConfig {

    private List<ConditionBranch> cases = new ArrayList<>();

    @Override
    public void validate() {
        if (cases == null || cases.isEmpty()) {
            throw new ConfigurationException("cases", "If-else node needs at least one case");
        }
        for (int i = 0; i < cases.size(); i++) {
            ConditionBranch branch = cases.get(i);
            if (branch.getConditions() == null || branch.getConditions().isEmpty()) {
                throw new ConfigurationException("cases[" + i + "].conditions", "Case " + (i + 1) + " has no conditions");
            }
            for (int j = 0; j < branch.getConditions().size(); j++) {
                ConditionDetail condition = branch.getConditions().get(j);
                String field = "cases[" + i + "].conditions[" + j + "]";
                if (condition.getLeft() == null || condition.getLeft().isBlank()) {
                    throw new ConfigurationException(field + ".left", "Condition is missing its left operand");
                }
                if (condition.getComparisonOperator() == null) {
                    throw new ConfigurationException(field + ".comparison_operator", "Condition is missing its operator");
                }
                if (!condition.getComparisonOperator().isUnary() && condition.getRight() == null) {
                    throw new ConfigurationException(field + ".right", "Condition is missing its right operand");
                }
            }
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConditionBranch {
        private LogicalOperator logicalOperator = LogicalOperator.AND;
        private List<ConditionDetail> conditions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConditionDetail {
        /** Expression, e.g. {@code "{{conv.score}}"}. */
        private String left;
        private ComparisonOperator comparisonOperator;
        /** Expression string, or a plain JSON value used as a literal. */
        private Object right;
    }
}
