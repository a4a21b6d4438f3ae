package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class MissingCommentException extends ApprovalWorkflowException {

    public MissingCommentException(String message) {
        super("MISSING_COMMENT", HttpStatus.BAD_REQUEST, message);
    }
}
