package com.enterprise.approval.dto.request;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateWorkflowRequest {

    @Size(max = 100, message = "Workflow name must not exceed 100 characters")
    private String name;

    @Size(max = 500, message = "Description must not exceed 500 characters")
    private String description;

    @Size(max = 64, message = "Flow key must not exceed 64 characters")
    private String flowKey;

    @Builder.Default
    private List<StepRequest> steps = new ArrayList<>();
}
