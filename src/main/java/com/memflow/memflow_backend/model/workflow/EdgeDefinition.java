package com.memflow.memflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EdgeDefinition {

    private String id;
    private String source;
    private String target;

    // "error" marks an edge that is only followed when the source node fails
    private String type;

    // Routing label (CASE1, CASE2, ERROR, ...) for edges leaving a routing node
    private String label;

    public static EdgeDefinition of(String source, String target) {
        return new EdgeDefinition(null, source, target, null, null);
    }

    public static EdgeDefinition labeled(String source, String target, String label) {
        return new EdgeDefinition(null, source, target, null, label);
    }

    public static EdgeDefinition error(String source, String target) {
        return new EdgeDefinition(null, source, target, "error", null);
    }

    @JsonIgnore
    public boolean isErrorEdge() {
        return "error".equalsIgnoreCase(type);
    }
}
