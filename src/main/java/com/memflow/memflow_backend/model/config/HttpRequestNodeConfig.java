package com.memflow.memflow_backend.model.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.memflow.memflow_backend.exception.ConfigurationException;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HttpRequestNodeConfig implements NodeConfig {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD");

    private String method = "GET";
    private String url;
    private Auth auth = new Auth();
    private Map<String, String> headers = new LinkedHashMap<>();
    private Map<String, String> params = new LinkedHashMap<>();
    private Body body = new Body();
    private Timeouts timeouts = new Timeouts();
    private Retry retry = new Retry();
    private ErrorHandle errorHandle = new ErrorHandle();

    @Override
    public void validate() {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("url", "HTTP request node needs a url");
        }
        if (method == null || !METHODS.contains(method.toUpperCase())) {
            throw new ConfigurationException("method", "Unsupported HTTP method: " + method);
        }
        if (auth.getAuthType() == AuthType.CUSTOM && (auth.getHeader() == null || auth.getHeader().isBlank())) {
            throw new ConfigurationException("auth.header", "Custom auth header not specified");
        }
        if (auth.getAuthType() != AuthType.NONE && (auth.getApiKey() == null || auth.getApiKey().isBlank())) {
            throw new ConfigurationException("auth.api_key", "API key for authentication not specified");
        }
        switch (body.getContentType()) {
            case JSON, FORM_URLENCODED -> {
                if (body.getData() != null && !(body.getData() instanceof Map<?, ?>)) {
                    throw new ConfigurationException("body.data", "JSON and x-www-form-urlencoded bodies must be objects");
                }
            }
            case FORM_DATA -> {
                if (body.getData() != null && !(body.getData() instanceof List<?>)) {
                    throw new ConfigurationException("body.data", "form-data bodies must be a list of fields");
                }
            }
            case RAW, BINARY -> {
                if (body.getData() != null && !(body.getData() instanceof String)) {
                    throw new ConfigurationException("body.data", "raw and binary bodies must be strings");
                }
            }
            case NONE -> {
            }
        }
        if (timeouts.getConnectTimeout() <= 0 || timeouts.getReadTimeout() <= 0) {
            throw new ConfigurationException("timeouts", "Timeouts must be positive");
        }
        if (retry.getMaxAttempts() < 1) {
            throw new ConfigurationException("retry.max_attempts", "max_attempts must be at least 1");
        }
        if (retry.getRetryInterval() < 0) {
            throw new ConfigurationException("retry.retry_interval", "retry_interval must not be negative");
        }
    }

    // ── Nested config ────────────────────────────────────────────────────────

    public enum AuthType {
        NONE("none"), BASIC("basic"), BEARER("bearer"), CUSTOM("custom");

        private final String value;

        AuthType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static AuthType fromValue(String value) {
            for (AuthType type : values()) {
                if (type.value.equalsIgnoreCase(value)) return type;
            }
            throw new IllegalArgumentException("Unknown auth type: " + value);
        }
    }

    public enum ContentType {
        NONE("none"),
        JSON("json"),
        FORM_DATA("form-data"),
        FORM_URLENCODED("x-www-form-urlencoded"),
        RAW("raw"),
        BINARY("binary");

        private final String value;

        ContentType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static ContentType fromValue(String value) {
            for (ContentType type : values()) {
                if (type.value.equalsIgnoreCase(value)) return type;
            }
            throw new IllegalArgumentException("Unknown content type: " + value);
        }
    }

    public enum ErrorHandleMethod {
        NONE("none"), DEFAULT("default"), BRANCH("branch");

        private final String value;

        ErrorHandleMethod(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static ErrorHandleMethod fromValue(String value) {
            for (ErrorHandleMethod method : values()) {
                if (method.value.equalsIgnoreCase(value)) return method;
            }
            throw new IllegalArgumentException("Unknown error handle method: " + value);
        }
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Auth {
        private AuthType authType = AuthType.NONE;
        /** Header name, used with {@code custom}. */
        private String header = "";
        private String apiKey = "";
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Body {
        private ContentType contentType = ContentType.NONE;
        /** Object for json/urlencoded, list of {key, type, value} for form-data, string for raw/binary. */
        private Object data;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeouts {
        /** Seconds. */
        private int connectTimeout = 5;
        private int readTimeout = 30;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Retry {
        private int maxAttempts = 1;
        /** Milliseconds. */
        private long retryInterval = 100;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorHandle {
        private ErrorHandleMethod method = ErrorHandleMethod.NONE;
        @JsonProperty("default")
        private ErrorDefault defaultValue = new ErrorDefault();
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorDefault {
        private String body = "";
        private int statusCode = 400;
        private Map<String, Object> headers = new LinkedHashMap<>();
    }
}
