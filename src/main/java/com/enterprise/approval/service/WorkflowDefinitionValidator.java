package com.enterprise.approval.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.enterprise.approval.config.ApprovalProperties;
import com.enterprise.approval.exception.WorkflowValidationException;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.enums.Role;

import lombok.RequiredArgsConstructor;

/**
 * Structural checks for workflow definitions. Collects every violation before
 * failing.
 */
@Component
@RequiredArgsConstructor
public class WorkflowDefinitionValidator {

    private final ApprovalProperties approvalProperties;

    public void validate(String name, String flowKey, List<StepDefinition> steps) {
        List<String> errors = new ArrayList<>();

        if (!StringUtils.hasText(name)) {
            errors.add("name is required");
        }
        if (!StringUtils.hasText(flowKey)) {
            errors.add("flowKey is required");
        }
        if (steps == null || steps.isEmpty()) {
            errors.add("at least one step is required");
        } else {
            if (steps.size() > approvalProperties.getMaxSteps()) {
                errors.add("a workflow may have at most " + approvalProperties.getMaxSteps() + " steps");
            }
            Set<String> seenIds = new HashSet<>();
            for (int i = 0; i < steps.size(); i++) {
                validateStep(i, steps.get(i), seenIds, errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
    }

    private void validateStep(int index, StepDefinition step, Set<String> seenIds, List<String> errors) {
        String prefix = "steps[" + index + "]";
        if (step == null) {
            errors.add(prefix + " must not be null");
            return;
        }
        if (!StringUtils.hasText(step.stepId())) {
            errors.add(prefix + ".stepId is required");
        } else if (!seenIds.add(step.stepId())) {
            errors.add(prefix + ".stepId '" + step.stepId() + "' is duplicated");
        }
        if (step.role() == null) {
            errors.add(prefix + ".role is required");
        }
        if (step.actions().isEmpty()) {
            errors.add(prefix + ".actions must contain at least one action");
        }
        if (step.slaHours() == null || step.slaHours() <= 0) {
            errors.add(prefix + ".slaHours must be a positive number");
        } else if (step.slaHours() > approvalProperties.getMaxSlaHours()) {
            errors.add(prefix + ".slaHours must not exceed " + approvalProperties.getMaxSlaHours());
        }
        if (step.order() != null && step.order() <= 0) {
            errors.add(prefix + ".order must be a positive number");
        }
        if (step.escalationRole() != null && step.escalationRole() == Role.EMPLOYEE) {
            errors.add(prefix + ".escalationRole must be MANAGER or ADMIN");
        }
        if (step.escalationHours() != null && step.escalationHours() <= 0) {
            errors.add(prefix + ".escalationHours must be a positive number");
        }
    }
}
