package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/*
 * group=false: "group_variables": ["{{a.output}}", "{{b.output}}"]
 * group=true:  "group_names": ["answer"], "group_variables": [["{{a.output}}", "{{b.output}}"]]
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableAggregatorNodeConfig implements NodeConfig {

    private boolean group;
    private List<String> groupNames = new ArrayList<>();
    /** Flat list of selectors, or one list of selectors per group. */
    private List<Object> groupVariables = new ArrayList<>();

    @Override
    public void validate() {
        if (groupVariables == null) {
            throw new ConfigurationException("group_variables", "group_variables must be a list");
        }
        if (!group) {
            for (int i = 0; i < groupVariables.size(); i++) {
                if (!(groupVariables.get(i) instanceof String)) {
                    throw new ConfigurationException("group_variables[" + i + "]",
                            "When group is false, group_variables must be a list of strings");
                }
            }
            return;
        }
        if (groupNames == null || groupNames.size() != groupVariables.size()) {
            throw new ConfigurationException("group_names", "group_names and group_variables length mismatch");
        }
        for (int i = 0; i < groupVariables.size(); i++) {
            if (!(groupVariables.get(i) instanceof List<?> selectors)) {
                throw new ConfigurationException("group_variables[" + i + "]",
                        "When group is true, each element of group_variables must be a list");
            }
            for (Object selector : selectors) {
                if (!(selector instanceof String)) {
                    throw new ConfigurationException("group_variables[" + i + "]",
                            "Each selector inside a group must be a string");
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    public List<String> selectorsOfGroup(int index) {
        return (List<String>) groupVariables.get(index);
    }

    public List<String> flatSelectors() {
        return groupVariables.stream().map(String::valueOf).toList();
    }
}
