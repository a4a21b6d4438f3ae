package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

public class CancelNotAllowedException extends ApprovalWorkflowException {

    private CancelNotAllowedException(HttpStatus status, String message) {
        super("CANCEL_NOT_ALLOWED", status, message);
    }

    public static CancelNotAllowedException notOwner() {
        return new CancelNotAllowedException(HttpStatus.FORBIDDEN, "You can only cancel your own requests");
    }

    public static CancelNotAllowedException notPending(Object status) {
        return new CancelNotAllowedException(HttpStatus.CONFLICT, "Cannot cancel request with status: " + status);
    }
}
