package com.hoteldesk.common.exception;

import lombok.Getter;

/**
 * Root of the front-desk error taxonomy.
 * Subclasses select the HTTP status in {@link GlobalExceptionHandler}; the error code travels to the client.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
