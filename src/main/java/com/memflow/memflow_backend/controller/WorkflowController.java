package com.memflow.memflow_backend.controller;

import com.memflow.memflow_backend.engine.WorkflowResult;
import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.model.domain.Execution;
import com.memflow.memflow_backend.model.domain.Workflow;
import com.memflow.memflow_backend.model.dto.WorkflowRunRequest;
import com.memflow.memflow_backend.model.dto.WorkflowSaveRequest;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import com.memflow.memflow_backend.service.WorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService workflowService;

    @GetMapping
    public List<Workflow> list() {
        return workflowService.list();
    }

    @PostMapping
    public ResponseEntity<Workflow> create(@Valid @RequestBody WorkflowSaveRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.create(request));
    }

    @GetMapping("/{workflowId}")
    public Workflow get(@PathVariable UUID workflowId) {
        return workflowService.get(workflowId);
    }

    @PutMapping("/{workflowId}")
    public Workflow update(@PathVariable UUID workflowId, @Valid @RequestBody WorkflowSaveRequest request) {
        return workflowService.update(workflowId, request);
    }

    // POST /api/workflows/validate: dry graph build, returns every problem at once
    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody WorkflowDefinition definition) {
        List<ValidationError> errors = workflowService.validate(definition);
        return new ValidationResult(errors.isEmpty(), errors);
    }

    // POST /api/workflows/{id}/run: blocks until the run finishes
    @PostMapping("/{workflowId}/run")
    public WorkflowResult run(@PathVariable UUID workflowId,
                              @RequestBody(required = false) WorkflowRunRequest request) {
        return workflowService.runSync(workflowId, orEmpty(request));
    }

    // POST /api/workflows/{id}/run-async: returns the execution id; events go to /topic/execution/{id}
    @PostMapping("/{workflowId}/run-async")
    public ResponseEntity<Map<String, Object>> runAsync(@PathVariable UUID workflowId,
                                                        @RequestParam(defaultValue = "false") boolean waitForSubscriber,
                                                        @RequestBody(required = false) WorkflowRunRequest request) {
        Execution execution = workflowService.runAsync(workflowId, orEmpty(request), waitForSubscriber);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "executionId", execution.getId().toString(),
                "status", execution.getStatus().name()
        ));
    }

    private static WorkflowRunRequest orEmpty(WorkflowRunRequest request) {
        return request != null ? request : new WorkflowRunRequest(null, null, null, null, null, null);
    }

    public record ValidationResult(boolean valid, List<ValidationError> errors) {}
}
