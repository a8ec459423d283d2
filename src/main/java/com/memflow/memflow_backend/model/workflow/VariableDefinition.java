package com.memflow.memflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declared variable: a start-node input or a conversation variable with its initial value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariableDefinition {

    private String name;

    // string | number | boolean | array | object
    private String type = "string";

    private boolean required;

    @JsonProperty("default")
    private Object defaultValue;

    private String description;
}
