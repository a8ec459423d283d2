package com.memflow.memflow_backend.executor.agent;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpAgentClientTest {

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final HttpAgentClient client = new HttpAgentClient(restTemplate, "http://agents.local/");

    @Test
    void sendsMessageWithContext() {
        server.expect(requestTo("http://agents.local/agents/planner/chat"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.message").value("plan my day"))
                .andExpect(jsonPath("$.conversation_id").value("c-1"))
                .andRespond(withSuccess("{\"output\": \"Start with email.\", \"trace\": []}", MediaType.APPLICATION_JSON));

        assertEquals("Start with email.", client.chat("planner", "plan my day", Map.of("conversation_id", "c-1")));
        server.verify();
    }

    @Test
    void serverErrorPropagates() {
        server.expect(requestTo("http://agents.local/agents/planner/chat")).andRespond(withServerError());

        assertThrows(HttpServerErrorException.class, () -> client.chat("planner", "hi", Map.of()));
    }
}
