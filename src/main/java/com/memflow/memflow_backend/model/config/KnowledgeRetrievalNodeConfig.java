package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnowledgeRetrievalNodeConfig implements NodeConfig {

    private String query;

    @JsonAlias("knowledge_bases")
    private List<String> kbIds = new ArrayList<>();

    private RetrieveType retrieveType = RetrieveType.PARTICIPLE;
    private int topK = 4;
    private double similarityThreshold = 0.2;
    private double vectorSimilarityWeight = 0.3;

    @Override
    public void validate() {
        if (query == null || query.isBlank()) {
            throw new ConfigurationException("query", "Knowledge retrieval node needs a query");
        }
        if (kbIds == null || kbIds.isEmpty()) {
            throw new ConfigurationException("kb_ids", "Knowledge retrieval node needs at least one knowledge base");
        }
        if (topK <= 0) {
            throw new ConfigurationException("top_k", "top_k must be positive");
        }
        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new ConfigurationException("similarity_threshold", "similarity_threshold must be between 0 and 1");
        }
        if (vectorSimilarityWeight < 0 || vectorSimilarityWeight > 1) {
            throw new ConfigurationException("vector_similarity_weight", "vector_similarity_weight must be between 0 and 1");
        }
    }
}
