package com.memflow.memflow_backend.executor.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls {@code POST {app.agent.endpoint}/agents/{agentId}/chat} and reads {@code {"output": "..."}}.
 */
@Slf4j
@Component
public class HttpAgentClient implements AgentClient {

    private final RestTemplate restTemplate;
    private final String endpoint;

    public HttpAgentClient(RestTemplate restTemplate, @Value("${app.agent.endpoint:}") String endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public String chat(String agentId, String message, Map<String, Object> context) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("Agent endpoint is not configured (app.agent.endpoint)");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;

        Map<String, Object> body = new LinkedHashMap<>(context);
        body.put("message", message);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ChatResponse response = restTemplate.postForObject(
                base + "/agents/{agentId}/chat", new HttpEntity<>(body, headers), ChatResponse.class, agentId);
        log.debug("Agent {} replied", agentId);
        return response != null && response.output() != null ? response.output() : "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(String output) {}
}
