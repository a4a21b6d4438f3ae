package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class RequestNotFoundException extends ApprovalWorkflowException {

    public RequestNotFoundException(String message) {
        super("REQUEST_NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }
}
