package com.enterprise.approval.dto.request;

import com.enterprise.approval.model.enums.ApprovalAction;
import com.enterprise.approval.model.enums.Role;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestActionRequest {

    @NotNull(message = "Action is required")
    private ApprovalAction action;

    @Size(max = 2000, message = "Comment must not exceed 2000 characters")
    private String comment;

    @Size(max = 100, message = "Delegate user id must not exceed 100 characters")
    private String delegateTo;

    private Role escalateTo;

    /** When set, the action only applies if the request is still on this step. */
    @PositiveOrZero
    private Integer expectedStepIndex;
}
