package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class InvalidActionException extends ApprovalWorkflowException {

    public InvalidActionException(String message) {
        super("INVALID_ACTION", HttpStatus.BAD_REQUEST, message);
    }
}
