package com.enterprise.approval.dto.request;

import java.util.Set;

import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.Role;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Step as submitted by clients. Structural checks are left to the workflow
 * validator so that every violation is reported together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepRequest {

    private String stepId;
    private Role role;
    private Set<ApprovalAction> actions;
    private Integer slaHours;
    private Boolean required;
    private Integer order;
    private Role escalationRole;
    private Integer escalationHours;

    public StepDefinition toStepDefinition() {
        return new StepDefinition(stepId, role, actions, slaHours, required, order, escalationRole, escalationHours);
    }
}
