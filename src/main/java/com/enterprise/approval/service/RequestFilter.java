package com.enterprise.approval.service;

import com.enterprise.approval.model.enums.RequestStatus;

/**
 * Optional filters for request listings. {@code mine} restricts the result to
 * requests created by the caller.
 */
public record RequestFilter(RequestStatus status, String type, boolean mine) {

    public static RequestFilter all() {
        return new RequestFilter(null, null, false);
    }
}
