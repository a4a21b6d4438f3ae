package com.enterprise.approval.model.entity;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.enterprise.approval.model.RequestState;
import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.converter.JsonDocumentConverter;
import com.enterprise.approval.model.converter.StepListConverter;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One approval case bound to a frozen snapshot of its workflow's steps.
 *
 * <p>
 * State columns (status, step index, deadline, escalation, delegation) are only
 * changed through the guarded update in
 * {@link com.enterprise.approval.repository.ApprovalRequestRepository#applyTransition}.
 * </p>
 */
@Entity
@Table(name = "approval_request", indexes = {
        @Index(name = "idx_request_status", columnList = "status"),
        @Index(name = "idx_request_created_by", columnList = "created_by"),
        @Index(name = "idx_request_sla_deadline", columnList = "sla_deadline"),
        @Index(name = "idx_request_submitted", columnList = "submitted_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApprovalRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_type", nullable = false, length = 64)
    private String type;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "flow_key", length = 64)
    private String flowKey;

    @Column(name = "workflow_version")
    private Integer workflowVersion;

    @Convert(converter = StepListConverter.class)
    @Column(name = "steps", nullable = false, updatable = false, columnDefinition = "TEXT")
    private List<StepDefinition> steps;

    @Column(name = "current_step_index", nullable = false)
    private Integer currentStepIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RequestStatus status;

    @Column(name = "sla_hours")
    private Integer slaHours;

    @Column(name = "sla_deadline")
    private LocalDateTime slaDeadline;

    @Column(name = "current_step_started_at")
    private LocalDateTime currentStepStartedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalated_to", length = 20)
    private Role escalatedTo;

    @Column(name = "delegated_to", length = 100)
    private String delegatedTo;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT")
    private Map<String, Object> payload;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = RequestStatus.PENDING;
        }
        if (currentStepIndex == null) {
            currentStepIndex = 0;
        }
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    public RequestState state() {
        return status == RequestStatus.PENDING
                ? RequestState.pending(currentStepIndex)
                : RequestState.terminal(status);
    }

    /**
     * Returns the step the request is waiting on, or {@code null} when the request
     * is not pending or its index falls outside the snapshot.
     */
    public StepDefinition currentStep() {
        return isPending() ? stepAtCurrentIndex() : null;
    }

    /**
     * Step the index points at regardless of status. Finished requests keep the
     * index of the step that closed them.
     */
    public StepDefinition stepAtCurrentIndex() {
        if (steps == null || currentStepIndex == null
                || currentStepIndex < 0 || currentStepIndex >= steps.size()) {
            return null;
        }
        return steps.get(currentStepIndex);
    }

    public boolean isOnLastStep() {
        return steps != null && currentStepIndex != null && currentStepIndex >= steps.size() - 1;
    }

    /**
     * Role currently expected to act: the escalation target when the step was
     * escalated, otherwise the step's own role.
     */
    public Role expectedRole() {
        if (escalatedTo != null) {
            return escalatedTo;
        }
        StepDefinition step = currentStep();
        return step != null ? step.role() : null;
    }
}
