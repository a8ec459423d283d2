package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.executor.knowledge.KnowledgeRetriever;
import com.memflow.memflow_backend.executor.knowledge.RetrievalQuery;
import com.memflow.memflow_backend.executor.knowledge.RetrievedChunk;
import com.memflow.memflow_backend.model.config.KnowledgeRetrievalNodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Searches the configured knowledge bases.
 *
 * <ul>
 *   <li>{@code participle}: full-text search, filtered by {@code similarity_threshold}</li>
 *   <li>{@code semantic}: vector search, filtered by {@code vector_similarity_weight}</li>
 *   <li>{@code hybrid}: both, deduplicated by document id and reranked by score</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KnowledgeRetrievalNodeExecutor implements NodeExecutor<KnowledgeRetrievalNodeConfig> {

    private final KnowledgeRetriever retriever;

    @Override
    public NodeType supportedType() {
        return NodeType.KNOWLEDGE_RETRIEVAL;
    }

    @Override
    public Class<KnowledgeRetrievalNodeConfig> configType() {
        return KnowledgeRetrievalNodeConfig.class;
    }

    @Override
    public Object execute(WorkflowNode<KnowledgeRetrievalNodeConfig> node, NodeExecutionContext ctx) {
        KnowledgeRetrievalNodeConfig config = node.getConfig();
        String query = ctx.render(config.getQuery(), true);

        List<RetrievedChunk> chunks;
        try {
            chunks = switch (config.getRetrieveType()) {
                case PARTICIPLE -> retriever.search(fullText(config, query));
                case SEMANTIC -> retriever.search(vector(config, query));
                case HYBRID -> merge(retriever.search(vector(config, query)),
                                     retriever.search(fullText(config, query)),
                                     config.getTopK());
            };
        } catch (RuntimeException e) {
            ctx.recordToolError("knowledge_retrieval", e.getMessage());
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("output", List.of());
            output.put("error", e.getMessage());
            return output;
        }

        log.info("Knowledge retrieval {} ({}) returned {} chunks", node.getId(), config.getRetrieveType(), chunks.size());
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("output", chunks.stream().map(KnowledgeRetrievalNodeExecutor::toMap).toList());
        return output;
    }

    private static RetrievalQuery fullText(KnowledgeRetrievalNodeConfig config, String query) {
        return new RetrievalQuery(query, config.getKbIds(), RetrievalQuery.FULL_TEXT,
                config.getTopK(), config.getSimilarityThreshold());
    }

    private static RetrievalQuery vector(KnowledgeRetrievalNodeConfig config, String query) {
        return new RetrievalQuery(query, config.getKbIds(), RetrievalQuery.VECTOR,
                config.getTopK(), config.getVectorSimilarityWeight());
    }

    /** First occurrence of each document wins; the result is ordered by score, highest first. */
    static List<RetrievedChunk> merge(List<RetrievedChunk> first, List<RetrievedChunk> second, int topK) {
        Set<String> seen = new HashSet<>();
        List<RetrievedChunk> unique = new ArrayList<>();
        for (List<RetrievedChunk> source : List.of(first, second)) {
            for (RetrievedChunk chunk : source) {
                if (chunk.docId() == null || seen.add(chunk.docId())) {
                    unique.add(chunk);
                }
            }
        }
        return unique.stream()
                .sorted(Comparator.comparingDouble(RetrievedChunk::score).reversed())
                .limit(topK)
                .toList();
    }

    private static Map<String, Object> toMap(RetrievedChunk chunk) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("doc_id", chunk.docId());
        map.put("kb_id", chunk.kbId());
        map.put("content", chunk.content());
        map.put("score", chunk.score());
        map.put("metadata", chunk.metadata() != null ? chunk.metadata() : Map.of());
        return map;
    }
}
