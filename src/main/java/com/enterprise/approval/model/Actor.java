package com.enterprise.approval.model;

import com.enterprise.approval.model.enums.Role;

/**
 * Identity of whoever performs an operation, captured at the time of the call.
 */
public record Actor(String id, String email, Role role) {

    public static final String SYSTEM_ID = "system";

    public static Actor system() {
        return new Actor(SYSTEM_ID, null, Role.ADMIN);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean hasRole(Role expected) {
        return role == expected;
    }
}
