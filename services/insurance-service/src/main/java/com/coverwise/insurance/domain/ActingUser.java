package com.coverwise.insurance.domain;

import com.coverwise.insurance.entity.UserRole;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Identity of the user performing an engine operation, as resolved by the authentication collaborator.
 */
public record ActingUser(
    String userId,
    String email,
    Set<UserRole> roles
) {
    public ActingUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        roles = roles == null || roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    public static ActingUser of(String userId, String email, UserRole... roles) {
        return new ActingUser(userId, email, roles.length == 0 ? Set.of() : EnumSet.of(roles[0], roles));
    }

    public boolean hasRole(UserRole role) {
        return roles.contains(role);
    }

    /**
     * Email when known, otherwise the user id.
     */
    public String displayName() {
        return email != null && !email.isBlank() ? email : userId;
    }
}
