package com.memflow.memflow_backend.model.domain;

import com.memflow.memflow_backend.model.workflow.WorkflowDefinition;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    // Nodes, edges and conversation variables, stored as one JSON document
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "definition")
    private WorkflowDefinition definition = new WorkflowDefinition();

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
