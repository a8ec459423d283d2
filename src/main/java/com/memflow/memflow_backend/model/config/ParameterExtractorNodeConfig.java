package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterExtractorNodeConfig implements NodeConfig {

    static final Set<String> PARAM_TYPES = Set.of(
            "string", "number", "boolean",
            "array[string]", "array[number]", "array[boolean]", "array[object]");

    private String modelId;
    private String text;
    private List<ParamDefinition> params = new ArrayList<>();
    /** Extra instructions appended to the extraction prompt. */
    private String prompt;

    @Override
    public void validate() {
        if (modelId == null || modelId.isBlank()) {
            throw new ConfigurationException("model_id", "Parameter extractor needs a model_id");
        }
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("text", "Parameter extractor needs input text");
        }
        if (params == null || params.isEmpty()) {
            throw new ConfigurationException("params", "Parameter extractor needs at least one parameter");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < params.size(); i++) {
            ParamDefinition param = params.get(i);
            if (param.getName() == null || param.getName().isBlank() || !names.add(param.getName())) {
                throw new ConfigurationException("params[" + i + "].name", "Parameter names must be unique and non-empty");
            }
            if (param.getType() == null || !PARAM_TYPES.contains(param.getType())) {
                throw new ConfigurationException("params[" + i + "].type", "Unsupported parameter type: " + param.getType());
            }
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParamDefinition {
        private String name;
        private String type;
        private String desc;
        private boolean required;
    }
}
