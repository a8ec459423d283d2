package com.memflow.memflow_backend.model.domain;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A model that LLM-backed nodes can reference through their {@code model_id}.
 */
@Entity
@Table(name = "model_configs")
public class ModelConfig {

    @Id
    @GeneratedValue
    private UUID id;

    /** Display name; nodes may reference the model by this name as well. */
    @Column(nullable = false, unique = true)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LlmProvider provider;

    @Column(name = "model_name", nullable = false)
    private String modelName;

    @Column(name = "api_key")
    private String apiKey;

    @Column(name = "endpoint")
    private String endpoint;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt = LocalDateTime.now();

    @PreUpdate
    void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public LlmProvider getProvider() { return provider; }
    public String getModelName() { return modelName; }
    public String getApiKey() { return apiKey; }
    public String getEndpoint() { return endpoint; }
    public boolean isEnabled() { return enabled; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public void setId(UUID id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setProvider(LlmProvider provider) { this.provider = provider; }
    public void setModelName(String modelName) { this.modelName = modelName; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public void setCreatedAt(LocalDateTime t) { this.createdAt = t; }
    public void setUpdatedAt(LocalDateTime t) { this.updatedAt = t; }
}
