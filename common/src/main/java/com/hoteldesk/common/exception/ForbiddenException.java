package com.hoteldesk.common.exception;

/**
 * Authenticated, but the principal's role does not allow the operation. Mapped to HTTP 403.
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String message) {
        super(message, "FORBIDDEN");
    }
}
