package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.model.workflow.VariableDefinition;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StartNodeConfig implements NodeConfig {

    /** Custom input variables read from {@code sys.input_variables}. */
    private List<VariableDefinition> variables = new ArrayList<>();

    @Override
    public void validate() {
        Set<String> seen = new HashSet<>();
        for (VariableDefinition variable : variables) {
            if (!seen.add(variable.getName())) {
                throw new ConfigurationException("variables", "Duplicate input variable: " + variable.getName());
            }
        }
    }
}
