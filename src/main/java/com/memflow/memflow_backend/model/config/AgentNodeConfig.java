package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentNodeConfig implements NodeConfig {

    private String agentId;
    /** Message template; defaults to the inbound user message. */
    private String message = "{{sys.message}}";

    @Override
    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new ConfigurationException("agent_id", "Agent node needs an agent_id");
        }
    }
}
