package com.memflow.memflow_backend.model.domain;

import com.memflow.memflow_backend.model.state.ExecutionStatus;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "executions")
@Data
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "conversation_id")
    private String conversationId;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "triggered_by")
    private String triggeredBy; // API, API_ASYNC

    // conv.* after the run; seeds the next turn of the same conversation
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conversation_variables")
    private Map<String, Object> conversationVariables;

    // Full WorkflowResult saved at the end of execution for audit/debug
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_snapshot")
    private Map<String, Object> resultSnapshot;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;
}
