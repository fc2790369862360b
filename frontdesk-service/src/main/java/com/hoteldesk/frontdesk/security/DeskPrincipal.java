package com.hoteldesk.frontdesk.security;

import com.hoteldesk.common.exception.ForbiddenException;
import com.hoteldesk.common.exception.UnauthorizedException;
import com.hoteldesk.frontdesk.domain.model.User;

import java.io.Serializable;

/**
 * Authenticated desk user acting on a request. Resolved by {@link AccessGate} at the
 * boundary and passed explicitly into every core operation.
 */
public record DeskPrincipal(Long id, String username, User.Role role) implements Serializable {

    public static DeskPrincipal from(User user) {
        return new DeskPrincipal(user.getId(), user.getUsername(), user.getRole());
    }

    /**
     * Core operations refuse to run without a principal.
     */
    public static DeskPrincipal require(DeskPrincipal principal) {
        if (principal == null) {
            throw new UnauthorizedException("Authentication required");
        }
        return principal;
    }

    public boolean hasRole(User.Role required) {
        return role == User.Role.ADMIN || role == required;
    }

    public void requireRole(User.Role required) {
        if (!hasRole(required)) {
            throw new ForbiddenException(
                    String.format("User %s with role %s may not perform this operation", username, role));
        }
    }
}
