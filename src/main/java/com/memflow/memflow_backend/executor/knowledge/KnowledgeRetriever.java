package com.memflow.memflow_backend.executor.knowledge;

import java.util.List;

/**
 * Boundary to the knowledge base search service. Implementations throw an unchecked
 * exception when the service cannot be reached or rejects the query.
 */
public interface KnowledgeRetriever {

    List<RetrievedChunk> search(RetrievalQuery query);
}
