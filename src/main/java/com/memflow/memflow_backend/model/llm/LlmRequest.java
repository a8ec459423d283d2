package com.memflow.memflow_backend.model.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Provider-agnostic chat request built by the LLM-backed nodes.
 * Either {@code messages} is set, or it is derived from the system and user prompts.
 */
public class LlmRequest {

    private String systemPrompt;
    private String userPrompt;
    private List<Map<String, String>> messages;
    private String model;
    private Integer maxTokens;
    private Double temperature;
    private boolean jsonOutput;

    public LlmRequest() {}

    public static LlmRequest of(String systemPrompt, String userPrompt) {
        LlmRequest request = new LlmRequest();
        request.systemPrompt = systemPrompt;
        request.userPrompt = userPrompt;
        return request;
    }

    /** Chat messages in provider order. */
    public List<Map<String, String>> toMessages() {
        if (messages != null && !messages.isEmpty()) {
            return messages;
        }
        List<Map<String, String>> built = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            built.add(Map.of("role", "system", "content", systemPrompt));
        }
        built.add(Map.of("role", "user", "content", userPrompt != null ? userPrompt : ""));
        return built;
    }

    public String getSystemPrompt() { return systemPrompt; }
    public String getUserPrompt() { return userPrompt; }
    public List<Map<String, String>> getMessages() { return messages; }
    public String getModel() { return model; }
    public Integer getMaxTokens() { return maxTokens; }
    public Double getTemperature() { return temperature; }
    public boolean isJsonOutput() { return jsonOutput; }

    public void setSystemPrompt(String s) { this.systemPrompt = s; }
    public void setUserPrompt(String s) { this.userPrompt = s; }
    public void setMessages(List<Map<String, String>> m) { this.messages = m; }
    public void setModel(String m) { this.model = m; }
    public void setMaxTokens(Integer n) { this.maxTokens = n; }
    public void setTemperature(Double t) { this.temperature = t; }
    public void setJsonOutput(boolean b) { this.jsonOutput = b; }
}
