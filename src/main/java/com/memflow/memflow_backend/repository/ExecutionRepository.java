package com.memflow.memflow_backend.repository;

import com.memflow.memflow_backend.model.domain.Execution;
import com.memflow.memflow_backend.model.state.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    List<Execution> findByWorkflowIdOrderByStartedAtDesc(UUID workflowId);

    // All executions newest-first
    List<Execution> findAllByOrderByStartedAtDesc();

    // Latest finished turn of a conversation, used to restore conv.* variables
    Optional<Execution> findFirstByWorkflowIdAndConversationIdAndStatusOrderByStartedAtDesc(
            UUID workflowId, String conversationId, ExecutionStatus status);
}
