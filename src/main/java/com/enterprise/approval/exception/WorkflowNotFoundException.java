package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class WorkflowNotFoundException extends ApprovalWorkflowException {

    public WorkflowNotFoundException(String message) {
        super("WORKFLOW_NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }
}
