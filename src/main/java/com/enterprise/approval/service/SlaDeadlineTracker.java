package com.enterprise.approval.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.repository.ApprovalRequestRepository;

import lombok.RequiredArgsConstructor;

/**
 * Deadline arithmetic and read-only SLA queries over pending requests.
 * Deadlines are flat wall-clock offsets from the start of a step.
 */
@Service
@RequiredArgsConstructor
public class SlaDeadlineTracker {

    private final ApprovalRequestRepository requestRepository;
    private final Clock clock;

    public LocalDateTime deadlineFor(StepDefinition step, LocalDateTime stepStart) {
        return stepStart.plusHours(step.slaHours());
    }

    /**
     * Pending requests whose deadline falls within the next {@code thresholdHours}.
     */
    @Transactional(readOnly = true)
    public List<ApprovalRequest> getWarnings(int thresholdHours) {
        LocalDateTime now = LocalDateTime.now(clock);
        return requestRepository.findByStatusAndSlaDeadlineBetweenOrderBySlaDeadlineAsc(
                RequestStatus.PENDING, now, now.plusHours(thresholdHours));
    }

    @Transactional(readOnly = true)
    public List<ApprovalRequest> getOverdue() {
        return requestRepository.findByStatusAndSlaDeadlineBeforeOrderBySlaDeadlineAsc(
                RequestStatus.PENDING, LocalDateTime.now(clock));
    }

    /**
     * Pending, not yet escalated requests whose current step escalates and whose
     * escalation time has passed.
     */
    @Transactional(readOnly = true)
    public List<ApprovalRequest> getEscalationCandidates() {
        LocalDateTime now = LocalDateTime.now(clock);
        return requestRepository.findByStatusAndEscalatedToIsNull(RequestStatus.PENDING).stream()
                .filter(request -> isEscalationDue(request, now))
                .toList();
    }

    /**
     * Escalation is due {@code escalationHours} after the step started when the
     * step sets them, otherwise at the step deadline.
     */
    public boolean isEscalationDue(ApprovalRequest request, LocalDateTime now) {
        StepDefinition step = request.currentStep();
        if (step == null || !step.escalates() || request.getEscalatedTo() != null) {
            return false;
        }
        LocalDateTime dueAt;
        if (step.escalationHours() != null && request.getCurrentStepStartedAt() != null) {
            dueAt = request.getCurrentStepStartedAt().plusHours(step.escalationHours());
        } else {
            dueAt = request.getSlaDeadline();
        }
        return dueAt != null && !now.isBefore(dueAt);
    }
}
