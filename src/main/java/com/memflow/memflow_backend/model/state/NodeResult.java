package com.memflow.memflow_backend.model.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeResult {
    private String nodeId;
    private String nodeType;
    private String nodeName;
    private NodeStatus status;

    private Map<String, Object> input;
    private Object output;

    private long elapsedMs;
    private TokenUsage tokenUsage;

    private String errorMessage;
}
