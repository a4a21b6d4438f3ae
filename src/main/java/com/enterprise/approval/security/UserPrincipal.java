package com.enterprise.approval.security;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.enums.Role;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class UserPrincipal implements UserDetails {

    private final String userId;
    private final String email;
    private final Set<String> roles;
    private final Collection<? extends GrantedAuthority> authorities;

    public static UserPrincipal create(String userId, String email, List<String> roles) {
        List<String> roleNames = roles == null ? List.of() : roles;
        Set<String> roleSet = roleNames.stream()
                .map(String::toUpperCase)
                .collect(Collectors.toUnmodifiableSet());
        List<GrantedAuthority> authorities = roleSet.stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                .collect(Collectors.toList());

        return UserPrincipal.builder()
                .userId(userId)
                .email(email)
                .roles(roleSet)
                .authorities(authorities)
                .build();
    }

    /**
     * The identity passed into the approval services. A principal holding several
     * roles acts with the most privileged one.
     */
    public Actor toActor() {
        return new Actor(userId, email, Role.highestOf(roles));
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return authorities;
    }

    @Override
    public String getPassword() {
        return null; // JWT-based auth doesn't use password in principal
    }

    @Override
    public String getUsername() {
        return userId;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    public boolean hasRole(String role) {
        return roles.contains(role.toUpperCase());
    }
}
