package com.enterprise.approval.service;

import org.springframework.stereotype.Component;

import com.enterprise.approval.exception.InsufficientRoleException;
import com.enterprise.approval.exception.InvalidActionException;
import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.Role;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether an actor may perform an action on the current step of a
 * request.
 */
@Component
@Slf4j
public class ActionAuthorizer {

    /**
     * @throws InvalidActionException     when the step does not allow the action
     * @throws InsufficientRoleException  when the actor may not act on the step
     */
    public void authorize(ApprovalRequest request, StepDefinition step, ApprovalAction action, Actor actor) {
        if (!step.allows(action)) {
            log.warn("Refused {} on request {} step {}: action not allowed", action, request.getId(), step.stepId());
            throw new InvalidActionException(
                    "Action " + action + " is not allowed on step " + step.stepId());
        }
        if (!isAuthorized(request, step, actor)) {
            log.warn("Refused {} on request {} step {}: actor {} with role {} is not authorized",
                    action, request.getId(), step.stepId(), actor.id(), actor.role());
            throw new InsufficientRoleException(
                    "Role " + actor.role() + " cannot act on step " + step.stepId()
                            + " (expected " + describeExpected(request, step) + ")");
        }
    }

    public boolean isAuthorized(ApprovalRequest request, StepDefinition step, Actor actor) {
        if (actor.isAdmin()) {
            return true;
        }
        if (request.getDelegatedTo() != null) {
            return request.getDelegatedTo().equals(actor.id());
        }
        return actor.hasRole(expectedRole(request, step));
    }

    private Role expectedRole(ApprovalRequest request, StepDefinition step) {
        return request.getEscalatedTo() != null ? request.getEscalatedTo() : step.role();
    }

    private String describeExpected(ApprovalRequest request, StepDefinition step) {
        if (request.getDelegatedTo() != null) {
            return "delegate " + request.getDelegatedTo();
        }
        return "role " + expectedRole(request, step);
    }
}
