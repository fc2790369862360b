package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.common.exception.ValidationException;

/**
 * Required-field checks for callers that reach the services without bean validation.
 */
final class RequestFields {

    private RequestFields() {
        // Utility class
    }

    /**
     * @return the trimmed value
     * @throws ValidationException if the value is null or blank
     */
    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }
}
