package com.enterprise.approval.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.enterprise.approval.dto.request.CreateWorkflowRequest;
import com.enterprise.approval.dto.request.StepRequest;
import com.enterprise.approval.dto.request.UpdateWorkflowRequest;
import com.enterprise.approval.exception.WorkflowNotFoundException;
import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.WorkflowDefinition;
import com.enterprise.approval.repository.WorkflowDefinitionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Versioned store of workflow definitions. Nothing here touches the step
 * snapshots of requests that already exist.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowDefinitionService {

    private final WorkflowDefinitionRepository workflowRepository;
    private final WorkflowDefinitionValidator validator;
    private final Clock clock;

    /**
     * Validates and stores a new definition. The version is one above the highest
     * existing version of the same flow key.
     */
    @Transactional
    public WorkflowDefinition create(CreateWorkflowRequest request, Actor actor) {
        List<StepDefinition> steps = toSteps(request.getSteps());
        validator.validate(request.getName(), request.getFlowKey(), steps);
        return store(request.getName(), request.getDescription(), request.getFlowKey(), steps, actor);
    }

    @Transactional(readOnly = true)
    public WorkflowDefinition findActive(String flowKey) {
        return workflowRepository.findFirstByFlowKeyAndActiveTrueOrderByDefinitionVersionDesc(flowKey)
                .orElseThrow(() -> new WorkflowNotFoundException("No active workflow found for flow key: " + flowKey));
    }

    @Transactional(readOnly = true)
    public WorkflowDefinition findById(UUID id) {
        return workflowRepository.findById(id)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow not found: " + id));
    }

    @Transactional(readOnly = true)
    public Page<WorkflowDefinition> list(Boolean active, Pageable pageable) {
        if (active == null) {
            return workflowRepository.findAll(pageable);
        }
        return workflowRepository.findByActive(active, pageable);
    }

    @Transactional
    public WorkflowDefinition update(UUID id, UpdateWorkflowRequest request, Actor actor) {
        WorkflowDefinition definition = findById(id);
        if (StringUtils.hasText(request.getName())) {
            definition.setName(request.getName());
        }
        if (request.getDescription() != null) {
            definition.setDescription(request.getDescription());
        }
        if (request.getActive() != null) {
            definition.setActive(request.getActive());
        }
        definition.setUpdatedBy(actor.id());
        definition.setUpdatedAt(LocalDateTime.now(clock));

        WorkflowDefinition saved = workflowRepository.save(definition);
        log.info("Workflow {} (flow {} v{}) updated by {}", id, saved.getFlowKey(),
                saved.getDefinitionVersion(), actor.id());
        return saved;
    }

    @Transactional
    public WorkflowDefinition deactivate(UUID id, Actor actor) {
        WorkflowDefinition definition = findById(id);
        definition.setActive(false);
        definition.setUpdatedBy(actor.id());
        definition.setUpdatedAt(LocalDateTime.now(clock));

        WorkflowDefinition saved = workflowRepository.save(definition);
        log.info("Workflow {} (flow {} v{}) deactivated by {}", id, saved.getFlowKey(),
                saved.getDefinitionVersion(), actor.id());
        return saved;
    }

    /**
     * Copies the steps and description of an existing definition into a new active
     * definition under another flow key.
     */
    @Transactional
    public WorkflowDefinition clone(UUID sourceId, String flowKey, String name, Actor actor) {
        WorkflowDefinition source = findById(sourceId);
        String cloneName = StringUtils.hasText(name) ? name : source.getName() + " (copy)";
        List<StepDefinition> steps = new ArrayList<>(source.getSteps());

        validator.validate(cloneName, flowKey, steps);
        WorkflowDefinition saved = store(cloneName, source.getDescription(), flowKey, steps, actor);
        log.info("Workflow {} cloned into {} (flow {})", sourceId, saved.getId(), flowKey);
        return saved;
    }

    private WorkflowDefinition store(String name, String description, String flowKey,
            List<StepDefinition> steps, Actor actor) {
        int version = workflowRepository.findMaxVersion(flowKey) + 1;
        LocalDateTime now = LocalDateTime.now(clock);

        WorkflowDefinition definition = WorkflowDefinition.builder()
                .name(name)
                .description(description)
                .flowKey(flowKey)
                .definitionVersion(version)
                .steps(steps)
                .active(true)
                .createdBy(actor.id())
                .updatedBy(actor.id())
                .createdAt(now)
                .updatedAt(now)
                .build();

        WorkflowDefinition saved = workflowRepository.save(definition);
        log.info("Workflow {} created: flow {} v{} with {} steps by {}", saved.getId(), flowKey, version,
                steps.size(), actor.id());
        return saved;
    }

    private List<StepDefinition> toSteps(List<StepRequest> steps) {
        if (steps == null) {
            return List.of();
        }
        List<StepDefinition> result = new ArrayList<>();
        for (StepRequest step : steps) {
            result.add(step == null ? null : step.toStepDefinition());
        }
        return result;
    }
}
