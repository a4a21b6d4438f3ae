package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class InsufficientRoleException extends ApprovalWorkflowException {

    public InsufficientRoleException(String message) {
        super("INSUFFICIENT_ROLE", HttpStatus.FORBIDDEN, message);
    }
}
