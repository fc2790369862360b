package com.hoteldesk.common.exception;

/**
 * Request clashes with current state (room taken, number already used).
 * Mapped to HTTP 409; retrying without user intervention would not help.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(message, "CONFLICT");
    }

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
