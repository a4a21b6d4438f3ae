package com.enterprise.approval.exception;

import java.util.List;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Structural validation failure of a workflow definition. Carries every
 * violation found, not only the first.
 */
@Getter
public class WorkflowValidationException extends ApprovalWorkflowException {

    private final List<String> errors;

    public WorkflowValidationException(List<String> errors) {
        super("WORKFLOW_VALIDATION_FAILED", HttpStatus.BAD_REQUEST, "Workflow validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }
}
