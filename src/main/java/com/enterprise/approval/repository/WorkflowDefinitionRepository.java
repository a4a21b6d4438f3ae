package com.enterprise.approval.repository;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.enterprise.approval.model.entity.WorkflowDefinition;

@Repository
public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findFirstByFlowKeyAndActiveTrueOrderByDefinitionVersionDesc(String flowKey);

    Page<WorkflowDefinition> findByActive(Boolean active, Pageable pageable);

    @Query("SELECT COALESCE(MAX(w.definitionVersion), 0) FROM WorkflowDefinition w WHERE w.flowKey = :flowKey")
    int findMaxVersion(@Param("flowKey") String flowKey);
}
