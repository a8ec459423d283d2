package com.memflow.memflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph of a workflow: nodes, the edges between them and the declared conversation variables.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowDefinition {

    private List<NodeDefinition> nodes = new ArrayList<>();
    private List<EdgeDefinition> edges = new ArrayList<>();

    /** Conversation variables and their initial values. */
    private List<VariableDefinition> variables = new ArrayList<>();
}
