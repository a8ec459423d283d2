package com.memflow.memflow_backend.repository;

import com.memflow.memflow_backend.model.domain.ModelConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ModelConfigRepository extends JpaRepository<ModelConfig, UUID> {

    Optional<ModelConfig> findByName(String name);
}
