package com.example.workflowhub.repository;

import com.example.workflowhub.domain.WorkflowDefinition;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findByWorkflowType(String workflowType);
}
