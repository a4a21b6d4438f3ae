package com.enterprise.approval.service;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.Role;

/**
 * Read visibility of requests. The creator and admins always see a request;
 * managers see it when the step at its current index is theirs or was
 * escalated to admin, which still holds once the request is finished.
 */
@Component
public class RequestAccessPolicy {

    public boolean canView(ApprovalRequest request, Actor actor) {
        if (actor.isAdmin() || actor.id().equals(request.getCreatedBy())) {
            return true;
        }
        if (actor.id().equals(request.getDelegatedTo())) {
            return true;
        }
        if (actor.hasRole(Role.MANAGER)) {
            StepDefinition step = request.stepAtCurrentIndex();
            return (step != null && step.role() == Role.MANAGER) || request.getEscalatedTo() == Role.ADMIN;
        }
        return false;
    }

    public void requireVisible(ApprovalRequest request, Actor actor) {
        if (!canView(request, actor)) {
            throw new AccessDeniedException("Access denied to request " + request.getId());
        }
    }
}
