package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransformNodeConfig implements NodeConfig {

    /** Output field name to template. */
    private Map<String, String> output = new LinkedHashMap<>();

    @Override
    public void validate() {
        if (output == null || output.isEmpty()) {
            throw new ConfigurationException("output", "Transform node needs at least one output field");
        }
    }
}
