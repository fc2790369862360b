package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ConflictException;

/**
 * Thrown when a record would reuse a unique business key (room number).
 */
public class DuplicateKeyException extends ConflictException {

    public DuplicateKeyException(String resourceType, String key) {
        super(String.format("%s %s already exists", resourceType, key), "DUPLICATE_KEY");
    }

    public DuplicateKeyException(String resourceType, String key, Throwable cause) {
        super(String.format("%s %s already exists", resourceType, key), cause, "DUPLICATE_KEY");
    }
}
