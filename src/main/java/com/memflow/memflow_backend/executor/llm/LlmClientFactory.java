package com.memflow.memflow_backend.executor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(ObjectMapper objectMapper) {
        register(new OpenAiCompatibleLlmClient(LlmProvider.OPENAI, "gpt-4o-mini", objectMapper));
        register(new OpenAiCompatibleLlmClient(LlmProvider.GROQ, "llama-3.3-70b-versatile", objectMapper));
        register(new OpenAiCompatibleLlmClient(LlmProvider.MISTRAL, "mistral-small-latest", objectMapper));
        register(new OpenAiCompatibleLlmClient(LlmProvider.DEEPSEEK, "deepseek-chat", objectMapper));
        register(new OpenAiCompatibleLlmClient(LlmProvider.CUSTOM, "", objectMapper));
    }

    public final void register(LlmClient client) {
        clientMap.put(client.getProvider(), client);
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }
}
