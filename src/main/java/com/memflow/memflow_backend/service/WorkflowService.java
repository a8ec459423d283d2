package com.memflow.memflow_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.exception.ValidationError;
import com.memflow.memflow_backend.engine.ExecutionEventPublisher;
import com.memflow.memflow_backend.engine.WorkflowExecutionEngine;
import com.memflow.memflow_backend.engine.WorkflowInput;
import com.memflow.memflow_backend.engine.WorkflowResult;
import com.memflow.memflow_backend.exception.ExecutionNotFoundException;
import com.memflow.memflow_backend.exception.WorkflowException;
import com.memflow.memflow_backend.exception.WorkflowNotFoundException;
import com.memflow.memflow_backend.model.domain.Execution;
import com.memflow.memflow_backend.model.domain.Workflow;
import com.memflow.memflow_backend.model.dto.WorkflowRunRequest;
import com.memflow.memflow_backend.model.dto.WorkflowSaveRequest;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import com.memflow.memflow_backend.repository.ExecutionRepository;
import com.memflow.memflow_backend.repository.WorkflowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WorkflowExecutionEngine engine;
    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final ExecutionEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    // ── Workflows ────────────────────────────────────────────────────────────

    public Workflow create(WorkflowSaveRequest request) {
        Workflow workflow = new Workflow();
        apply(workflow, request);
        return workflowRepository.save(workflow);
    }

    public Workflow update(UUID id, WorkflowSaveRequest request) {
        Workflow workflow = get(id);
        apply(workflow, request);
        return workflowRepository.save(workflow);
    }

    public Workflow get(UUID id) {
        return workflowRepository.findById(id).orElseThrow(() -> new WorkflowNotFoundException(id));
    }

    public List<Workflow> list() {
        return workflowRepository.findAllByOrderByUpdatedAtDesc();
    }

    public List<ValidationError> validate(WorkflowDefinition definition) {
        return engine.validate(definition);
    }

    private static void apply(Workflow workflow, WorkflowSaveRequest request) {
        workflow.setName(request.name());
        workflow.setDescription(request.description());
        workflow.setDefinition(request.definition());
    }

    // ── Executions ───────────────────────────────────────────────────────────

    public Execution getExecution(UUID id) {
        return executionRepository.findById(id).orElseThrow(() -> new ExecutionNotFoundException(id));
    }

    public List<Execution> listExecutions(UUID workflowId) {
        return workflowId != null
                ? executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId)
                : executionRepository.findAllByOrderByStartedAtDesc();
    }

    /**
     * Runs the workflow and blocks until it completes. Configuration and node failures
     * are rethrown after the execution row has been marked as failed.
     */
    public WorkflowResult runSync(UUID workflowId, WorkflowRunRequest request) {
        Workflow workflow = get(workflowId);
        Execution execution = startExecution(workflow, request, "API");
        return run(workflow, execution, request, false);
    }

    /**
     * Persists the execution and returns immediately (status RUNNING). The run streams its
     * events over STOMP, so clients subscribe to {@code /topic/execution/{id}} with the returned id.
     *
     * @param waitForSubscriber when true, delays the start by 1.5 s so a client can subscribe first
     */
    public Execution runAsync(UUID workflowId, WorkflowRunRequest request, boolean waitForSubscriber) {
        Workflow workflow = get(workflowId);
        Execution execution = startExecution(workflow, request, "API_ASYNC");

        Runnable task = () -> {
            try {
                run(workflow, execution, request, true);
            } catch (WorkflowException e) {
                // already recorded on the execution row and published to subscribers
                log.debug("Async execution {} ended with {}", execution.getId(), e.getClass().getSimpleName());
            }
        };
        if (waitForSubscriber) {
            CompletableFuture.delayedExecutor(1500, TimeUnit.MILLISECONDS).execute(task);
        } else {
            CompletableFuture.runAsync(task);
        }
        return execution;
    }

    private Execution startExecution(Workflow workflow, WorkflowRunRequest request, String triggeredBy) {
        Execution execution = new Execution();
        execution.setWorkflowId(workflow.getId());
        execution.setConversationId(request.conversationId());
        execution.setTriggeredBy(triggeredBy);
        return executionRepository.save(execution);
    }

    private WorkflowResult run(Workflow workflow, Execution execution, WorkflowRunRequest request, boolean streaming) {
        WorkflowInput input = WorkflowInput.builder()
                .workflowId(workflow.getId().toString())
                .executionId(execution.getId().toString())
                .message(request.message())
                .conversationId(request.conversationId())
                .workspaceId(request.workspaceId())
                .userId(request.userId())
                .inputVariables(request.inputs() != null ? request.inputs() : Map.of())
                .conversationVariables(conversationVariables(workflow.getId(), request))
                .build();
        try {
            WorkflowResult result = engine.execute(workflow.getDefinition(), input, eventPublisher, streaming);
            execution.setStatus(result.status());
            execution.setConversationVariables(result.conversationVariables());
            execution.setResultSnapshot(objectMapper.convertValue(result, MAP_TYPE));
            execution.setErrorMessage(result.error());
            return result;
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Workflow {} execution {} failed: {}", workflow.getId(), execution.getId(), msg);
            execution.setStatus(ExecutionStatus.FAILURE);
            execution.setErrorMessage(msg);
            execution.setResultSnapshot(Map.of("error", msg));
            throw e;
        } finally {
            execution.setCompletedAt(Instant.now());
            executionRepository.save(execution);
        }
    }

    /** conv.* from the last successful turn of the conversation, overridden by the request. */
    private Map<String, Object> conversationVariables(UUID workflowId, WorkflowRunRequest request) {
        Map<String, Object> conv = new LinkedHashMap<>();
        if (request.conversationId() != null && !request.conversationId().isBlank()) {
            executionRepository.findFirstByWorkflowIdAndConversationIdAndStatusOrderByStartedAtDesc(
                            workflowId, request.conversationId(), ExecutionStatus.SUCCESS)
                    .map(Execution::getConversationVariables)
                    .ifPresent(conv::putAll);
        }
        if (request.conversationVariables() != null) {
            conv.putAll(request.conversationVariables());
        }
        return conv;
    }
}
