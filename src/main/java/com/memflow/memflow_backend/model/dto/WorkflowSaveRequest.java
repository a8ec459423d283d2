package com.memflow.memflow_backend.model.dto;

import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record WorkflowSaveRequest(
        @NotBlank String name,
        String description,
        @NotNull WorkflowDefinition definition
) {}
