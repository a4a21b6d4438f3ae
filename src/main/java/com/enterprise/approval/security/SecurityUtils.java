package com.enterprise.approval.security;

import java.util.Optional;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.enterprise.approval.model.Actor;

/**
 * Utility class for security-related operations.
 */
@Component
public class SecurityUtils {

    /**
     * Gets the current authenticated user principal.
     *
     * @return Optional containing the UserPrincipal if authenticated
     */
    public Optional<UserPrincipal> getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal) {
            return Optional.of((UserPrincipal) authentication.getPrincipal());
        }
        return Optional.empty();
    }

    /**
     * Gets the acting identity of the current request.
     *
     * @return the actor
     * @throws AuthenticationCredentialsNotFoundException when nobody is authenticated
     */
    public Actor requireCurrentActor() {
        return getCurrentUser()
                .map(UserPrincipal::toActor)
                .orElseThrow(() -> new AuthenticationCredentialsNotFoundException("No authenticated user"));
    }
}
