package com.enterprise.approval.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.enterprise.approval.model.StepDefinition;
import com.enterprise.approval.model.entity.WorkflowDefinition;
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
public class WorkflowDefinitionResponse {

    private UUID id;
    private String name;
    private String description;
    private String flowKey;
    private Integer version;
    private List<StepDefinition> steps;
    private boolean active;
    private String createdBy;
    private String updatedBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static WorkflowDefinitionResponse from(WorkflowDefinition definition) {
        return WorkflowDefinitionResponse.builder()
                .id(definition.getId())
                .name(definition.getName())
                .description(definition.getDescription())
                .flowKey(definition.getFlowKey())
                .version(definition.getDefinitionVersion())
                .steps(definition.getSteps())
                .active(definition.isActive())
                .createdBy(definition.getCreatedBy())
                .updatedBy(definition.getUpdatedBy())
                .createdAt(definition.getCreatedAt())
                .updatedAt(definition.getUpdatedAt())
                .build();
    }
}
