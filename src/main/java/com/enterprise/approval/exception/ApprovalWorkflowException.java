package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Base type of every definitive outcome of a refused operation. None of these
 * are retried by the service.
 */
@Getter
public abstract class ApprovalWorkflowException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    protected ApprovalWorkflowException(String errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected ApprovalWorkflowException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }
}
