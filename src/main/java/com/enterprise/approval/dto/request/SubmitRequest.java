package com.enterprise.approval.dto.request;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

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
public class SubmitRequest {

    @NotBlank(message = "Request type is required")
    @Size(max = 64, message = "Request type must not exceed 64 characters")
    private String type;

    private UUID workflowId;

    @Size(max = 64, message = "Flow key must not exceed 64 characters")
    private String flowKey;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();
}
