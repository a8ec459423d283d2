package com.memflow.memflow_backend.executor.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** One chunk returned by the retrieval service. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievedChunk(
        @JsonProperty("doc_id") String docId,
        @JsonProperty("kb_id") String kbId,
        String content,
        double score,
        Map<String, Object> metadata
) {}
