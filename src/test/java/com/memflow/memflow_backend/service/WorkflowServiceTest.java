package com.memflow.memflow_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.engine.ExecutionEventPublisher;
import com.memflow.memflow_backend.engine.WorkflowExecutionEngine;
import com.memflow.memflow_backend.engine.WorkflowInput;
import com.memflow.memflow_backend.engine.WorkflowResult;
import com.memflow.memflow_backend.exception.NodeExecutionException;
import com.memflow.memflow_backend.exception.WorkflowNotFoundException;
import com.memflow.memflow_backend.model.domain.Execution;
import com.memflow.memflow_backend.model.domain.Workflow;
import com.memflow.memflow_backend.model.dto.WorkflowRunRequest;
import com.memflow.memflow_backend.model.dto.WorkflowSaveRequest;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import com.memflow.memflow_backend.model.state.TokenUsage;
import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import com.memflow.memflow_backend.repository.ExecutionRepository;
import com.memflow.memflow_backend.repository.WorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    private static final UUID WORKFLOW_ID = UUID.fromString("4f1c1e5e-1111-4c4c-9a9a-000000000001");

    @Mock
    private WorkflowExecutionEngine engine;
    @Mock
    private WorkflowRepository workflowRepository;
    @Mock
    private ExecutionRepository executionRepository;
    @Mock
    private ExecutionEventPublisher eventPublisher;

    private WorkflowService service;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        service = new WorkflowService(engine, workflowRepository, executionRepository, eventPublisher, new ObjectMapper());
        workflow = new Workflow();
        workflow.setId(WORKFLOW_ID);
        workflow.setName("support bot");
        lenient().when(executionRepository.save(any(Execution.class))).thenAnswer(invocation -> {
            Execution execution = invocation.getArgument(0);
            if (execution.getId() == null) {
                execution.setId(UUID.randomUUID());
            }
            return execution;
        });
    }

    private static WorkflowResult result(ExecutionStatus status, Map<String, Object> conv) {
        return new WorkflowResult("exec", WORKFLOW_ID.toString(), status, "answer", conv,
                Map.of(), List.of("start", "end"), TokenUsage.ZERO, List.of(), null, null, 12);
    }

    @Test
    void createCopiesRequestFields() {
        when(workflowRepository.save(any(Workflow.class))).thenAnswer(invocation -> invocation.getArgument(0));
        WorkflowDefinition definition = new WorkflowDefinition();

        Workflow created = service.create(new WorkflowSaveRequest("faq", "answers questions", definition));

        assertEquals("faq", created.getName());
        assertEquals("answers questions", created.getDescription());
        assertSame(definition, created.getDefinition());
    }

    @Test
    void missingWorkflowRaises() {
        when(workflowRepository.findById(WORKFLOW_ID)).thenReturn(Optional.empty());

        assertThrows(WorkflowNotFoundException.class, () -> service.runSync(WORKFLOW_ID, emptyRequest()));
        verify(executionRepository, never()).save(any());
    }

    @Test
    void listExecutionsFiltersByWorkflowWhenGiven() {
        service.listExecutions(WORKFLOW_ID);
        service.listExecutions(null);

        verify(executionRepository).findByWorkflowIdOrderByStartedAtDesc(WORKFLOW_ID);
        verify(executionRepository).findAllByOrderByStartedAtDesc();
    }

    private static WorkflowRunRequest emptyRequest() {
        return new WorkflowRunRequest(null, null, null, null, null, null);
    }

    @Nested
    @DisplayName("runSync")
    class RunSync {

        @BeforeEach
        void workflowExists() {
            when(workflowRepository.findById(WORKFLOW_ID)).thenReturn(Optional.of(workflow));
        }

        @Test
        @DisplayName("restores conv.* from the last successful turn, with request values on top")
        void restoresConversationVariables() {
            Execution previous = new Execution();
            previous.setConversationVariables(Map.of("topic", "billing", "turns", 1L));
            when(executionRepository.findFirstByWorkflowIdAndConversationIdAndStatusOrderByStartedAtDesc(
                    WORKFLOW_ID, "c-1", ExecutionStatus.SUCCESS)).thenReturn(Optional.of(previous));
            when(engine.execute(any(), any(), eq(eventPublisher), eq(false)))
                    .thenReturn(result(ExecutionStatus.SUCCESS, Map.of("topic", "billing", "turns", 2L)));

            service.runSync(WORKFLOW_ID, new WorkflowRunRequest("hi", "c-1", "ws", "u-1", null, Map.of("turns", 5L)));

            ArgumentCaptor<WorkflowInput> input = ArgumentCaptor.forClass(WorkflowInput.class);
            verify(engine).execute(any(), input.capture(), eq(eventPublisher), eq(false));
            assertEquals(Map.of("topic", "billing", "turns", 5L), input.getValue().getConversationVariables());
            assertEquals("hi", input.getValue().getMessage());
            assertEquals(WORKFLOW_ID.toString(), input.getValue().getWorkflowId());
            assertEquals(Map.of(), input.getValue().getInputVariables());
        }

        @Test
        void successfulRunIsRecorded() {
            when(engine.execute(any(), any(), any(), anyBoolean()))
                    .thenReturn(result(ExecutionStatus.SUCCESS, Map.of("turns", 1L)));

            WorkflowResult result = service.runSync(WORKFLOW_ID, emptyRequest());

            ArgumentCaptor<Execution> saved = ArgumentCaptor.forClass(Execution.class);
            verify(executionRepository, times(2)).save(saved.capture());
            Execution execution = saved.getValue();
            assertEquals("answer", result.output());
            assertEquals(ExecutionStatus.SUCCESS, execution.getStatus());
            assertEquals("API", execution.getTriggeredBy());
            assertEquals(Map.of("turns", 1L), execution.getConversationVariables());
            assertEquals("answer", execution.getResultSnapshot().get("output"));
            assertNotNull(execution.getCompletedAt());
        }

        @Test
        @DisplayName("a failed run is marked FAILURE and the error reaches the caller")
        void failedRunIsRecorded() {
            NodeExecutionException failure = new NodeExecutionException("llm", "provider down", null);
            when(engine.execute(any(), any(), any(), anyBoolean())).thenThrow(failure);

            assertSame(failure, assertThrows(NodeExecutionException.class,
                    () -> service.runSync(WORKFLOW_ID, emptyRequest())));

            ArgumentCaptor<Execution> saved = ArgumentCaptor.forClass(Execution.class);
            verify(executionRepository, times(2)).save(saved.capture());
            Execution execution = saved.getValue();
            assertEquals(ExecutionStatus.FAILURE, execution.getStatus());
            assertEquals("Node 'llm' failed: provider down", execution.getErrorMessage());
            assertEquals(Map.of("error", "Node 'llm' failed: provider down"), execution.getResultSnapshot());
            assertNotNull(execution.getCompletedAt());
        }
    }
}
