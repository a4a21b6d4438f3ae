package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

/**
 * Another transition on the same request committed, or is in flight, so this one
 * was refused without writing anything.
 */
public class ConcurrentModificationException extends ApprovalWorkflowException {

    public ConcurrentModificationException(String message) {
        super("CONCURRENT_MODIFICATION", HttpStatus.CONFLICT, message);
    }

    public ConcurrentModificationException(String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", HttpStatus.CONFLICT, message, cause);
    }
}
