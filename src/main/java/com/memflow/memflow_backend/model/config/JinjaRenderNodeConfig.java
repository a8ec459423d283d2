package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class JinjaRenderNodeConfig implements NodeConfig {

    private String template;

    /** Local names made available to {@link #template}, each rendered from workflow variables. */
    private List<VariableMapping> mapping = new ArrayList<>();

    @Override
    public void validate() {
        if (template == null) {
            throw new ConfigurationException("template", "Template render node needs a template");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < mapping.size(); i++) {
            VariableMapping entry = mapping.get(i);
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new ConfigurationException("mapping[" + i + "].name", "Mapping name must not be empty");
            }
            if (!names.add(entry.getName())) {
                throw new ConfigurationException("mapping[" + i + "].name", "Duplicate mapping name: " + entry.getName());
            }
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VariableMapping {
        private String name;
        private String value;
    }
}
