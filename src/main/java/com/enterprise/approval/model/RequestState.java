package com.enterprise.approval.model;

import com.enterprise.approval.model.enums.RequestStatus;

/**
 * Position of a request in its state machine: {@code pending(i)} or a terminal status.
 */
public record RequestState(RequestStatus status, Integer stepIndex) {

    public static RequestState pending(int stepIndex) {
        return new RequestState(RequestStatus.PENDING, stepIndex);
    }

    public static RequestState terminal(RequestStatus status) {
        return new RequestState(status, null);
    }

    @Override
    public String toString() {
        if (status == RequestStatus.PENDING) {
            return "pending(" + stepIndex + ")";
        }
        return status.name().toLowerCase();
    }
}
