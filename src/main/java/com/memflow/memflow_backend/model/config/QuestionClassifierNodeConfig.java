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

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuestionClassifierNodeConfig implements NodeConfig {

    private String modelId;
    private String inputVariable = "{{sys.message}}";
    private List<Category> categories = new ArrayList<>();
    private String userSupplementPrompt;
    private String outputVariable = "class_name";

    @Override
    public void validate() {
        if (modelId == null || modelId.isBlank()) {
            throw new ConfigurationException("model_id", "Question classifier needs a model_id");
        }
        if (categories == null || categories.isEmpty()) {
            throw new ConfigurationException("categories", "Question classifier needs at least one category");
        }
        for (int i = 0; i < categories.size(); i++) {
            String name = categories.get(i).getClassName();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("categories[" + i + "].class_name", "Category name must not be empty");
            }
        }
        if (outputVariable == null || outputVariable.isBlank() || "output".equals(outputVariable)) {
            throw new ConfigurationException("output_variable", "output_variable must be set and must not be 'output'");
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Category {
        private String className;
    }
}
