package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ConflictException;
import com.hoteldesk.frontdesk.domain.model.Room;

/**
 * Thrown when a room status change is not allowed from its current status,
 * e.g. occupying a room that is already occupied.
 */
public class InvalidStateTransitionException extends ConflictException {

    public InvalidStateTransitionException(String roomNumber, Room.RoomStatus from, Room.RoomStatus to) {
        super(String.format("Room %s cannot move from %s to %s", roomNumber, from, to),
                "INVALID_STATE_TRANSITION");
    }

    public InvalidStateTransitionException(String roomNumber, Room.RoomStatus to, Throwable cause) {
        super(String.format("Room %s changed concurrently, cannot move to %s", roomNumber, to),
                cause, "INVALID_STATE_TRANSITION");
    }
}
