package com.enterprise.approval.exception;

import org.springframework.http.HttpStatus;

/**
 * A pending request whose step index does not resolve to a step. Unreachable
 * while the snapshot invariants hold.
 */
public class NoActiveStepException extends ApprovalWorkflowException {

    public NoActiveStepException(String message) {
        super("NO_ACTIVE_STEP", HttpStatus.BAD_REQUEST, message);
    }
}
