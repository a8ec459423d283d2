package com.memflow.memflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class WorkflowEngineConfig {

    /** Shared client for the knowledge and agent services. */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${app.http.default-connect-timeout-seconds:5}") long connectTimeout,
                                     @Value("${app.http.default-read-timeout-seconds:30}") long readTimeout) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeout))
                .setReadTimeout(Duration.ofSeconds(readTimeout))
                .build();
    }
}
