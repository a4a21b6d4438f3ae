package com.enterprise.approval.worker;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.enterprise.approval.config.SlaProperties;
import com.enterprise.approval.exception.ApprovalWorkflowException;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.service.RequestLifecycleManager;
import com.enterprise.approval.service.SlaDeadlineTracker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic SLA sweep. Logs requests close to their deadline and escalates
 * overdue steps that define an escalation role.
 */
@Component
@ConditionalOnProperty(prefix = "app.sla.escalation", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SlaEscalationWorker {

    private final SlaDeadlineTracker slaTracker;
    private final RequestLifecycleManager lifecycleManager;
    private final SlaProperties slaProperties;

    @Scheduled(fixedDelayString = "${app.sla.escalation.interval-ms:300000}")
    public void sweep() {
        List<ApprovalRequest> warnings = slaTracker.getWarnings(slaProperties.getWarningThresholdHours());
        for (ApprovalRequest request : warnings) {
            log.warn("SLA WARNING - request {} step {} due at {}", request.getId(),
                    request.getCurrentStepIndex(), request.getSlaDeadline());
        }

        int escalated = 0;
        for (ApprovalRequest request : slaTracker.getEscalationCandidates()) {
            log.warn("SLA BREACH - escalating request {} step {} (deadline {})", request.getId(),
                    request.getCurrentStepIndex(), request.getSlaDeadline());
            try {
                if (lifecycleManager.escalateOverdue(request.getId())) {
                    escalated++;
                }
            } catch (ApprovalWorkflowException e) {
                log.info("Skipped escalation of request {}: {}", request.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Escalation of request {} failed", request.getId(), e);
            }
        }
        if (escalated > 0) {
            log.info("SLA sweep escalated {} request(s)", escalated);
        }
    }
}
