package com.memflow.memflow_backend.model.domain;

/**
 * LLM providers reachable through an OpenAI-compatible chat completions API.
 */
public enum LlmProvider {

    OPENAI("OpenAI GPT",             "https://api.openai.com/v1/chat/completions"),
    GROQ("Groq (Fast inference)",    "https://api.groq.com/openai/v1/chat/completions"),
    MISTRAL("Mistral AI",            "https://api.mistral.ai/v1/chat/completions"),
    DEEPSEEK("DeepSeek",             "https://api.deepseek.com/chat/completions"),
    CUSTOM("Custom / Self-hosted",   "");  // endpoint comes from the model config

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName    = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()    { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }
}
