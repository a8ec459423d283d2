package com.memflow.memflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a workflow definition.
 *
 * <pre>
 * { "id": "llm_qa", "type": "llm", "name": "Answer", "config": { "model_id": "...", "prompt": "..." } }
 * </pre>
 *
 * Type-specific fields may also sit next to {@code id}/{@code type}; they are collected into {@code config}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeDefinition {

    private String id;
    private String type;
    private String name;
    private String description;
    private List<String> tags = new ArrayList<>();

    private Map<String, Object> config = new LinkedHashMap<>();

    public void setConfig(Map<String, Object> values) {
        if (values != null) {
            config.putAll(values);
        }
    }

    @JsonAnySetter
    public void putConfigValue(String key, Object value) {
        config.put(key, value);
    }

    @JsonIgnore
    public NodeType getNodeType() {
        return NodeType.fromTag(type);
    }

    @JsonIgnore
    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
