package com.memflow.memflow_backend.executor.impl;

import com.memflow.memflow_backend.exception.ConfigurationException;
import com.memflow.memflow_backend.exception.NodeExecutionException;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.model.config.HttpRequestNodeConfig;
import com.memflow.memflow_backend.model.config.HttpRequestNodeConfig.ContentType;
import com.memflow.memflow_backend.model.config.HttpRequestNodeConfig.ErrorDefault;
import com.memflow.memflow_backend.model.config.HttpRequestNodeConfig.ErrorHandleMethod;
import com.memflow.memflow_backend.model.config.HttpRequestNodeConfig.Timeouts;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes HTTP-REQUEST nodes.
 *
 * Every string in the config (url, header names and values, params, body fields) is
 * rendered against the run's variables before the call. Failed calls are retried
 * {@code retry.max_attempts} times in total; what the node returns once they are
 * exhausted depends on {@code error_handle.method}:
 *
 *   none:    empty body with the last status code and headers
 *   default: the configured {@code error_handle.default} response
 *   branch:  routes through the edge labelled {@code ERROR}
 */
@Slf4j
@Component
public class HttpRequestNodeExecutor implements NodeExecutor<HttpRequestNodeConfig> {

    public static final String SUCCESS = "SUCCESS";
    public static final String ERROR = "ERROR";

    static final String DEFAULT_USER_AGENT = "memflow-workflow/1.0";

    private final RestTemplateBuilder restTemplateBuilder;

    public HttpRequestNodeExecutor(RestTemplateBuilder restTemplateBuilder) {
        this.restTemplateBuilder = restTemplateBuilder;
    }

    @Override
    public NodeType supportedType() {
        return NodeType.HTTP_REQUEST;
    }

    @Override
    public Class<HttpRequestNodeConfig> configType() {
        return HttpRequestNodeConfig.class;
    }

    @Override
    public void validate(HttpRequestNodeConfig config) {
        config.validate();
        if (config.getBody().getContentType() == ContentType.BINARY) {
            throw new ConfigurationException("body.content_type", "binary request bodies are not supported");
        }
    }

    @Override
    public Object execute(WorkflowNode<HttpRequestNodeConfig> node, NodeExecutionContext ctx) {
        HttpRequestNodeConfig config = node.getConfig();
        HttpMethod method = HttpMethod.valueOf(config.getMethod().toUpperCase());
        URI uri = buildUri(config, ctx);
        HttpEntity<Object> request = new HttpEntity<>(buildBody(config, ctx), buildHeaders(config, ctx));
        RestTemplate restTemplate = restTemplateFor(config.getTimeouts());

        int attempts = config.getRetry().getMaxAttempts();
        int lastStatus = 0;
        Map<String, String> lastHeaders = Map.of();
        String lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ResponseEntity<String> response = restTemplate.exchange(uri, method, request, String.class);
                log.info("HTTP node {} {} {} -> {}", node.getId(), method, uri, response.getStatusCode().value());
                Map<String, Object> output = response(
                        response.getBody() != null ? response.getBody() : "",
                        response.getStatusCode().value(),
                        response.getHeaders().toSingleValueMap());
                output.put("output", SUCCESS);
                return output;
            } catch (HttpStatusCodeException ex) {
                lastStatus = ex.getStatusCode().value();
                lastHeaders = ex.getResponseHeaders() != null ? ex.getResponseHeaders().toSingleValueMap() : Map.of();
                lastError = "HTTP " + lastStatus + ": " + ex.getStatusText();
            } catch (RestClientException ex) {
                lastError = ex.getMessage();
            }
            log.warn("HTTP node {} attempt {}/{} failed: {}", node.getId(), attempt, attempts, lastError);
            if (attempt < attempts) {
                pause(node.getId(), config.getRetry().getRetryInterval());
            }
        }

        ctx.recordToolError("http_request", lastError);
        return switch (config.getErrorHandle().getMethod()) {
            case NONE -> response("", lastStatus, lastHeaders);
            case DEFAULT -> {
                ErrorDefault fallback = config.getErrorHandle().getDefaultValue();
                yield response(fallback.getBody(), fallback.getStatusCode(), fallback.getHeaders());
            }
            case BRANCH -> {
                Map<String, Object> output = response("", lastStatus, lastHeaders);
                output.put("error", lastError);
                output.put("output", ERROR);
                yield output;
            }
        };
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    @Override
    public boolean isRouting(HttpRequestNodeConfig config) {
        return config.getErrorHandle().getMethod() == ErrorHandleMethod.BRANCH;
    }

    @Override
    public String routingLabel(HttpRequestNodeConfig config, Object output) {
        return output instanceof Map<?, ?> map && map.get("output") != null ? map.get("output").toString() : null;
    }

    @Override
    public String defaultEdgeLabel(HttpRequestNodeConfig config, int index) {
        return SUCCESS;
    }

    // ── Request building ─────────────────────────────────────────────────────

    /** One client per timeout pair; the builder is shared and immutable. */
    protected RestTemplate restTemplateFor(Timeouts timeouts) {
        return restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(timeouts.getConnectTimeout()))
                .setReadTimeout(Duration.ofSeconds(timeouts.getReadTimeout()))
                .build();
    }

    private URI buildUri(HttpRequestNodeConfig config, NodeExecutionContext ctx) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(ctx.render(config.getUrl(), true));
        config.getParams().forEach((key, value) ->
                builder.queryParam(ctx.render(key, true), ctx.render(value, true)));
        return builder.encode().build().toUri();
    }

    private HttpHeaders buildHeaders(HttpRequestNodeConfig config, NodeExecutionContext ctx) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT);
        config.getHeaders().forEach((key, value) -> headers.set(ctx.render(key, true), ctx.render(value, true)));

        HttpRequestNodeConfig.Auth auth = config.getAuth();
        switch (auth.getAuthType()) {
            case BASIC -> headers.set(HttpHeaders.AUTHORIZATION, "Basic " + ctx.render(auth.getApiKey(), true));
            case BEARER -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + ctx.render(auth.getApiKey(), true));
            case CUSTOM -> headers.set(auth.getHeader(), ctx.render(auth.getApiKey(), true));
            case NONE -> {
            }
        }

        switch (config.getBody().getContentType()) {
            case JSON -> headers.setContentType(MediaType.APPLICATION_JSON);
            case FORM_URLENCODED -> headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            case FORM_DATA -> headers.setContentType(MediaType.MULTIPART_FORM_DATA);
            case RAW -> {
                if (!headers.containsKey(HttpHeaders.CONTENT_TYPE)) headers.setContentType(MediaType.TEXT_PLAIN);
            }
            case NONE, BINARY -> {
            }
        }
        return headers;
    }

    private Object buildBody(HttpRequestNodeConfig config, NodeExecutionContext ctx) {
        Object data = config.getBody().getData();
        return switch (config.getBody().getContentType()) {
            case NONE, BINARY -> null;
            case JSON -> data != null ? renderDeep(data, ctx) : Map.of();
            case RAW -> data != null ? ctx.render(data.toString(), true) : "";
            case FORM_URLENCODED -> {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                if (data instanceof Map<?, ?> fields) {
                    fields.forEach((k, v) -> form.add(ctx.render(k.toString(), true),
                            v != null ? ctx.render(v.toString(), true) : ""));
                }
                yield form;
            }
            case FORM_DATA -> {
                MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
                if (data instanceof List<?> fields) {
                    for (Object field : fields) {
                        if (!(field instanceof Map<?, ?> item)) continue;
                        Object type = item.get("type");
                        if (type != null && !"text".equals(type.toString())) {
                            log.warn("Skipping form-data field of type '{}': only text fields are sent", type);
                            continue;
                        }
                        Object key = item.get("key");
                        Object value = item.get("value");
                        if (key == null) continue;
                        form.add(ctx.render(key.toString(), true), value != null ? ctx.render(value.toString(), true) : "");
                    }
                }
                yield form;
            }
        };
    }

    /** Renders every string inside a JSON-shaped value, keys included. */
    private Object renderDeep(Object value, NodeExecutionContext ctx) {
        if (value instanceof String s) {
            return ctx.render(s, true);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            map.forEach((k, v) -> rendered.put(ctx.render(String.valueOf(k), true), renderDeep(v, ctx)));
            return rendered;
        }
        if (value instanceof List<?> list) {
            List<Object> rendered = new ArrayList<>(list.size());
            list.forEach(item -> rendered.add(renderDeep(item, ctx)));
            return rendered;
        }
        return value;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Map<String, Object> response(String body, int statusCode, Map<String, ?> headers) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("body", body);
        output.put("status_code", statusCode);
        output.put("headers", headers != null ? new LinkedHashMap<>(headers) : Map.of());
        return output;
    }

    private static void pause(String nodeId, long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(nodeId, "interrupted while waiting to retry", e);
        }
    }
}
