package com.memflow.memflow_backend.executor.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Calls {@code POST {app.knowledge.endpoint}/search} and reads {@code {"chunks": [...]}}.
 */
@Slf4j
@Component
public class HttpKnowledgeRetriever implements KnowledgeRetriever {

    private final RestTemplate restTemplate;
    private final String endpoint;

    public HttpKnowledgeRetriever(RestTemplate restTemplate,
                                  @Value("${app.knowledge.endpoint:}") String endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public List<RetrievedChunk> search(RetrievalQuery query) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("Knowledge retrieval endpoint is not configured (app.knowledge.endpoint)");
        }
        String url = endpoint.endsWith("/") ? endpoint + "search" : endpoint + "/search";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        SearchResponse response = restTemplate.postForObject(url, new HttpEntity<>(query, headers), SearchResponse.class);

        List<RetrievedChunk> chunks = response != null && response.chunks() != null ? response.chunks() : List.of();
        log.debug("Knowledge search ({}) over {} returned {} chunks", query.mode(), query.kbIds(), chunks.size());
        return chunks;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<RetrievedChunk> chunks) {}
}
