package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class NoStepsConfiguredException extends ApprovalWorkflowException {

    public NoStepsConfiguredException(String message) {
        super("NO_WORKFLOW_STEPS", HttpStatus.BAD_REQUEST, message);
    }
}
