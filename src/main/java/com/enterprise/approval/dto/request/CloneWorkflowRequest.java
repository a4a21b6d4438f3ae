package com.enterprise.approval.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloneWorkflowRequest {

    @NotBlank(message = "Flow key is required")
    @Size(max = 64, message = "Flow key must not exceed 64 characters")
    private String flowKey;

    @Size(max = 100, message = "Workflow name must not exceed 100 characters")
    private String name;
}
