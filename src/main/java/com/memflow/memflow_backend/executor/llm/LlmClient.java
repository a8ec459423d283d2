package com.memflow.memflow_backend.executor.llm;

import com.memflow.memflow_backend.model.domain.LlmProvider;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;

import java.util.function.Consumer;

public interface LlmClient {

    LlmProvider getProvider();

    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    /**
     * Streams the completion, handing every text delta to {@code onChunk} as it arrives.
     * The returned response carries the full text. Clients without streaming support
     * deliver the whole answer as a single chunk.
     */
    default LlmResponse stream(LlmRequest request, String apiKey, String endpoint, Consumer<String> onChunk) {
        LlmResponse response = call(request, apiKey, endpoint);
        if (response.isSuccess() && response.getRawText() != null) {
            onChunk.accept(response.getRawText());
        }
        return response;
    }

    String getDefaultModel();
}
