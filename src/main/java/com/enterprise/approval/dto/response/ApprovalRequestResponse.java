package com.enterprise.approval.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.ApprovalRequest;
import com.enterprise.approval.model.enums.RequestStatus;
import com.enterprise.approval.model.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalRequestResponse {

    private UUID id;
    private String type;
    private UUID workflowId;
    private String flowKey;
    private Integer workflowVersion;
    private RequestStatus status;
    private Integer currentStepIndex;
    private String currentStepId;
    private Role expectedRole;
    private List<StepDefinition> steps;
    private Integer slaHours;
    private LocalDateTime slaDeadline;
    private Role escalatedTo;
    private String delegatedTo;
    private Map<String, Object> payload;
    private String createdBy;
    private LocalDateTime submittedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;

    public static ApprovalRequestResponse from(ApprovalRequest request) {
        StepDefinition current = request.currentStep();
        return ApprovalRequestResponse.builder()
                .id(request.getId())
                .type(request.getType())
                .workflowId(request.getWorkflowId())
                .flowKey(request.getFlowKey())
                .workflowVersion(request.getWorkflowVersion())
                .status(request.getStatus())
                .currentStepIndex(request.getCurrentStepIndex())
                .currentStepId(current != null ? current.stepId() : null)
                .expectedRole(request.isPending() ? request.expectedRole() : null)
                .steps(request.getSteps())
                .slaHours(request.getSlaHours())
                .slaDeadline(request.getSlaDeadline())
                .escalatedTo(request.getEscalatedTo())
                .delegatedTo(request.getDelegatedTo())
                .payload(request.getPayload())
                .createdBy(request.getCreatedBy())
                .submittedAt(request.getSubmittedAt())
                .completedAt(request.getCompletedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
