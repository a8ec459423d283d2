package com.memflow.memflow_backend.repository;

import com.memflow.memflow_backend.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    List<Workflow> findAllByOrderByUpdatedAtDesc();
}
