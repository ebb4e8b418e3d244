package com.example.resourceapi.security.context;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.List;

/**
 * Authenticated caller as seen by the resource layer.
 */
public record Token(
        String userId,
        List<String> roles
) {
    public static final String ROLES_CLAIM = "roles";

    public Token {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static Token fromJwt(Jwt jwt) {
        return new Token(jwt.getSubject(), jwt.getClaimAsStringList(ROLES_CLAIM));
    }

    public boolean hasRole(String role) {
        return role != null && roles.stream().anyMatch(role::equalsIgnoreCase);
    }

    public boolean hasAnyRole(Collection<String> required) {
        return required.stream().anyMatch(this::hasRole);
    }
}
