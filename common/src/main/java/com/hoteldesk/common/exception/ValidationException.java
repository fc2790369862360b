package com.hoteldesk.common.exception;

/**
 * Input the caller has to correct (bad date range, missing field). Never retried.
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }

    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
