package com.hoteldesk.frontdesk.api.dto;

import com.hoteldesk.frontdesk.domain.model.Room;

import java.math.BigDecimal;

public record RoomResponse(
        Long id,
        String number,
        String type,
        BigDecimal rate,
        Room.RoomStatus status
) {
    public static RoomResponse from(Room room) {
        return new RoomResponse(room.getId(), room.getNumber(), room.getType(), room.getRate(), room.getStatus());
    }
}
