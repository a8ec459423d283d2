package com.memflow.memflow_backend.model.llm;

import com.memflow.memflow_backend.model.state.TokenUsage;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one chat completion. A failed call is returned as a value with
 * {@code success == false}; clients do not throw.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LlmResponse {

    private final boolean success;

    /** Completion text, or everything streamed so far. */
    private final String rawText;
    private final String errorMessage;
    private final int inputTokens;
    private final int outputTokens;

    /** Model the provider reports having used. */
    private final String model;

    public static LlmResponse ok(String rawText, String model, int inputTokens, int outputTokens) {
        return new LlmResponse(true, rawText, null, inputTokens, outputTokens, model);
    }

    public static LlmResponse error(String message) {
        return new LlmResponse(false, null, message, 0, 0, null);
    }

    public TokenUsage tokenUsage() {
        return TokenUsage.of(inputTokens, outputTokens);
    }
}
