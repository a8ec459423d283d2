package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmNodeConfig implements NodeConfig {

    private static final Set<String> ROLES = Set.of("system", "user", "assistant");

    private String modelId;
    private String prompt;
    private List<MessageConfig> messages = new ArrayList<>();
    private Double temperature;
    private Integer maxTokens;

    @Override
    public void validate() {
        if (modelId == null || modelId.isBlank()) {
            throw new ConfigurationException("model_id", "LLM node needs a model_id");
        }
        boolean hasPrompt = prompt != null && !prompt.isBlank();
        boolean hasMessages = messages != null && !messages.isEmpty();
        if (!hasPrompt && !hasMessages) {
            throw new ConfigurationException("prompt", "LLM node needs a prompt or messages");
        }
        if (hasMessages) {
            for (int i = 0; i < messages.size(); i++) {
                String role = messages.get(i).getRole();
                if (role == null || !ROLES.contains(role.toLowerCase())) {
                    throw new ConfigurationException("messages[" + i + "].role", "Unknown message role: " + role);
                }
            }
        }
        if (temperature != null && (temperature < 0 || temperature > 2)) {
            throw new ConfigurationException("temperature", "temperature must be between 0 and 2");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new ConfigurationException("max_tokens", "max_tokens must be positive");
        }
    }
}
