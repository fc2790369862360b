package com.hoteldesk.common.exception;

/**
 * No authenticated session, or credentials rejected. Mapped to HTTP 401.
 */
public class UnauthorizedException extends BusinessException {
    public UnauthorizedException(String message) {
        super(message, "UNAUTHORIZED");
    }
}
