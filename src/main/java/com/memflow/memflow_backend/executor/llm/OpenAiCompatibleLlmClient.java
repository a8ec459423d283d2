package com.memflow.memflow_backend.executor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.model.domain.LlmProvider;
import com.memflow.memflow_backend.model.llm.LlmRequest;
import com.memflow.memflow_backend.model.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Chat completions client for every provider that speaks the OpenAI wire format.
 * Streaming uses server-sent events ({@code data: {...}} lines terminated by {@code data: [DONE]}).
 */
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

    private static final String SSE_DATA = "data:";
    private static final String SSE_DONE = "[DONE]";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    private final LlmProvider provider;
    private final String defaultModel;

    public OpenAiCompatibleLlmClient(LlmProvider provider, String defaultModel, ObjectMapper mapper) {
        this(provider, defaultModel, mapper,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    OpenAiCompatibleLlmClient(LlmProvider provider, String defaultModel, ObjectMapper mapper, HttpClient httpClient) {
        this.provider = provider;
        this.defaultModel = defaultModel;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String model = resolveModel(req);
        try {
            HttpRequest httpReq = buildRequest(req, model, apiKey, endpoint, false);
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[{}] HTTP {}", provider, httpResp.statusCode());
                return LlmResponse.error(provider.getDisplayName() + " API error " + httpResp.statusCode()
                        + ": " + extractError(httpResp.body()));
            }
            JsonNode resp = mapper.readTree(httpResp.body());
            String text = resp.path("choices").path(0).path("message").path("content").asText("");
            JsonNode usage = resp.path("usage");
            return LlmResponse.ok(text, resp.path("model").asText(model),
                    usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(provider.getDisplayName() + " call interrupted");
        } catch (Exception e) {
            log.error("[{}] Exception calling API", provider, e);
            return LlmResponse.error(provider.getDisplayName() + " client exception: " + e.getMessage());
        }
    }

    @Override
    public LlmResponse stream(LlmRequest req, String apiKey, String endpoint, Consumer<String> onChunk) {
        String model = resolveModel(req);
        try {
            HttpRequest httpReq = buildRequest(req, model, apiKey, endpoint, true);
            HttpResponse<Stream<String>> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofLines());
            if (httpResp.statusCode() != 200) {
                String body;
                try (Stream<String> lines = httpResp.body()) {
                    body = String.join("\n", (Iterable<String>) lines::iterator);
                }
                log.error("[{}] HTTP {} (stream)", provider, httpResp.statusCode());
                return LlmResponse.error(provider.getDisplayName() + " API error " + httpResp.statusCode()
                        + ": " + extractError(body));
            }

            StringBuilder full = new StringBuilder();
            String usedModel = model;
            int inputTokens = 0;
            int outputTokens = 0;
            try (Stream<String> lines = httpResp.body()) {
                Iterator<String> it = lines.iterator();
                while (it.hasNext()) {
                    String line = it.next().trim();
                    if (!line.startsWith(SSE_DATA)) continue;
                    String data = line.substring(SSE_DATA.length()).trim();
                    if (SSE_DONE.equals(data)) break;

                    JsonNode event = mapper.readTree(data);
                    usedModel = event.path("model").asText(usedModel);
                    String delta = event.path("choices").path(0).path("delta").path("content").asText("");
                    if (!delta.isEmpty()) {
                        full.append(delta);
                        onChunk.accept(delta);
                    }
                    JsonNode usage = event.path("usage");
                    if (usage.isObject()) {
                        inputTokens = usage.path("prompt_tokens").asInt(inputTokens);
                        outputTokens = usage.path("completion_tokens").asInt(outputTokens);
                    }
                }
            }
            return LlmResponse.ok(full.toString(), usedModel, inputTokens, outputTokens);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(provider.getDisplayName() + " stream interrupted");
        } catch (Exception e) {
            log.error("[{}] Exception streaming from API", provider, e);
            return LlmResponse.error(provider.getDisplayName() + " client exception: " + e.getMessage());
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String resolveModel(LlmRequest req) {
        return (req.getModel() != null && !req.getModel().isBlank()) ? req.getModel() : defaultModel;
    }

    private HttpRequest buildRequest(LlmRequest req, String model, String apiKey, String endpoint, boolean stream)
            throws IOException {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : provider.getDefaultEndpoint();
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("No endpoint configured for provider " + provider);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", req.toMessages());
        if (req.getMaxTokens() != null)   body.put("max_tokens", req.getMaxTokens());
        if (req.getTemperature() != null) body.put("temperature", req.getTemperature());
        if (req.isJsonOutput())           body.put("response_format", Map.of("type", "json_object"));
        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private String extractError(String body) {
        try {
            JsonNode parsed = mapper.readTree(body);
            JsonNode msg = parsed.path("error").path("message");
            if (msg.isTextual()) {
                return msg.asText();
            }
        } catch (IOException e) {
            log.debug("[{}] Error body is not JSON", provider);
        }
        return fallbackBody(body);
    }

    private static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
