package com.enterprise.approval.model.enums;

import java.util.Collection;

/**
 * Roles an actor can hold. Ordered from least to most privileged.
 */
public enum Role {
    EMPLOYEE,
    MANAGER,
    ADMIN;

    /**
     * Resolves the most privileged role from a collection of role names,
     * ignoring names that are not known roles.
     *
     * @param roleNames role names, case-insensitive
     * @return the highest role, or EMPLOYEE when none match
     */
    public static Role highestOf(Collection<String> roleNames) {
        Role highest = EMPLOYEE;
        if (roleNames == null) {
            return highest;
        }
        for (String name : roleNames) {
            for (Role role : values()) {
                if (role.name().equalsIgnoreCase(name) && role.ordinal() > highest.ordinal()) {
                    highest = role;
                }
            }
        }
        return highest;
    }
}
