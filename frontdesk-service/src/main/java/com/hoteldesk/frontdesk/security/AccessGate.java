package com.hoteldesk.frontdesk.security;

import com.hoteldesk.common.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Boundary capability check. Controllers call {@link #currentPrincipal(HttpServletRequest)}
 * before invoking the core; the principal lives in the HTTP session established at login.
 */
@Slf4j
@Component
public class AccessGate {

    static final String SESSION_PRINCIPAL = "frontdesk.principal";

    public DeskPrincipal currentPrincipal(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        Object principal = session == null ? null : session.getAttribute(SESSION_PRINCIPAL);
        if (!(principal instanceof DeskPrincipal deskPrincipal)) {
            throw new UnauthorizedException("Authentication required");
        }
        return deskPrincipal;
    }

    public void signIn(HttpServletRequest request, DeskPrincipal principal) {
        HttpSession existing = request.getSession(false);
        if (existing != null) {
            existing.invalidate();
        }
        request.getSession(true).setAttribute(SESSION_PRINCIPAL, principal);
        log.info("User {} signed in with role {}", principal.username(), principal.role());
    }

    public void signOut(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            Object principal = session.getAttribute(SESSION_PRINCIPAL);
            session.invalidate();
            if (principal instanceof DeskPrincipal deskPrincipal) {
                log.info("User {} signed out", deskPrincipal.username());
            }
        }
    }
}
