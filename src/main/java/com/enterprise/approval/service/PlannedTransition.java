package com.enterprise.approval.service;

import java.time.LocalDateTime;

import com.enterprise.approval.model.RequestState;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;

/**
 * Complete set of state columns a request will hold after a transition.
 */
record PlannedTransition(
        RequestStatus status,
        int stepIndex,
        Integer slaHours,
        LocalDateTime slaDeadline,
        LocalDateTime stepStartedAt,
        Role escalatedTo,
        String delegatedTo,
        LocalDateTime completedAt) {

    static PlannedTransition advance(int nextIndex, int slaHours, LocalDateTime deadline, LocalDateTime now) {
        return new PlannedTransition(RequestStatus.PENDING, nextIndex, slaHours, deadline, now, null, null, null);
    }

    static PlannedTransition complete(ApprovalRequest request, RequestStatus status, LocalDateTime now) {
        return new PlannedTransition(status, request.getCurrentStepIndex(), request.getSlaHours(),
                request.getSlaDeadline(), request.getCurrentStepStartedAt(), request.getEscalatedTo(),
                request.getDelegatedTo(), now);
    }

    /** Escalation hands the step to another role; an open delegation no longer applies. */
    static PlannedTransition escalate(ApprovalRequest request, Role target) {
        return new PlannedTransition(RequestStatus.PENDING, request.getCurrentStepIndex(), request.getSlaHours(),
                request.getSlaDeadline(), request.getCurrentStepStartedAt(), target, null, null);
    }

    static PlannedTransition delegate(ApprovalRequest request, String delegateUserId) {
        return new PlannedTransition(RequestStatus.PENDING, request.getCurrentStepIndex(), request.getSlaHours(),
                request.getSlaDeadline(), request.getCurrentStepStartedAt(), request.getEscalatedTo(),
                delegateUserId, null);
    }

    RequestState state() {
        return status == RequestStatus.PENDING ? RequestState.pending(stepIndex) : RequestState.terminal(status);
    }
}
