package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ConflictException;

/**
 * Thrown when a booking targets a room that is not available, including the case where a
 * concurrent booking took the room first.
 */
public class RoomUnavailableException extends ConflictException {

    public RoomUnavailableException(String roomNumber) {
        super(String.format("Room %s is not available", roomNumber), "ROOM_UNAVAILABLE");
    }

    public RoomUnavailableException(String roomNumber, Throwable cause) {
        super(String.format("Room %s is not available", roomNumber), cause, "ROOM_UNAVAILABLE");
    }
}
