package com.memflow.memflow_backend.controller;

import com.memflow.memflow_backend.model.domain.Execution;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import com.memflow.memflow_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final WorkflowService workflowService;

    // GET /api/executions[?workflowId=]: newest first
    @GetMapping
    public List<ExecutionSummary> list(@RequestParam(required = false) UUID workflowId) {
        return workflowService.listExecutions(workflowId).stream()
                .map(ExecutionController::toSummary)
                .toList();
    }

    // GET /api/executions/{id}: includes the full result snapshot (node results, errors)
    @GetMapping("/{id}")
    public ExecutionDetail get(@PathVariable UUID id) {
        Execution e = workflowService.getExecution(id);
        return new ExecutionDetail(
                e.getId().toString(),
                e.getWorkflowId().toString(),
                e.getConversationId(),
                e.getStatus(),
                e.getTriggeredBy(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                e.getCompletedAt() != null ? e.getCompletedAt().toString() : null,
                durationMs(e),
                e.getErrorMessage(),
                e.getConversationVariables(),
                e.getResultSnapshot()
        );
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private static ExecutionSummary toSummary(Execution e) {
        return new ExecutionSummary(
                e.getId().toString(),
                e.getWorkflowId().toString(),
                e.getConversationId(),
                e.getStatus(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                durationMs(e)
        );
    }

    private static Long durationMs(Execution e) {
        if (e.getStartedAt() == null || e.getCompletedAt() == null) return null;
        return Duration.between(e.getStartedAt(), e.getCompletedAt()).toMillis();
    }

    public record ExecutionSummary(
            String id,
            String workflowId,
            String conversationId,
            ExecutionStatus status,
            String startedAt,
            Long durationMs
    ) {}

    public record ExecutionDetail(
            String id,
            String workflowId,
            String conversationId,
            ExecutionStatus status,
            String triggeredBy,
            String startedAt,
            String completedAt,
            Long durationMs,
            String errorMessage,
            Map<String, Object> conversationVariables,
            Map<String, Object> resultSnapshot
    ) {}
}
