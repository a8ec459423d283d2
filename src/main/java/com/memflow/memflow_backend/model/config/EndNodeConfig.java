package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EndNodeConfig implements NodeConfig {

    /** Output template; blank means the configured default text. */
    private String output;

    @Override
    public void validate() {
        // any template is acceptable here, syntax is checked when the graph is built
    }
}
