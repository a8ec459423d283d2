package com.memflow.memflow_backend.executor.knowledge;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single search against the retrieval service.
 *
 * @param mode {@code full_text} or {@code vector}
 */
public record RetrievalQuery(
        String query,
        @JsonProperty("kb_ids") List<String> kbIds,
        String mode,
        @JsonProperty("top_k") int topK,
        @JsonProperty("score_threshold") double scoreThreshold
) {
    public static final String FULL_TEXT = "full_text";
    public static final String VECTOR = "vector";
}
