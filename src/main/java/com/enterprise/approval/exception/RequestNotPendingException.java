package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class RequestNotPendingException extends ApprovalWorkflowException {

    public RequestNotPendingException(String message) {
        super("REQUEST_NOT_PENDING", HttpStatus.CONFLICT, message);
    }
}
