package com.hoteldesk.frontdesk.api.dto;

import com.hoteldesk.frontdesk.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Booking joined with its client and room for display.
 */
public record BookingResponse(
        Long id,
        Long clientId,
        String clientName,
        Long roomId,
        String roomNumber,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        BigDecimal totalPrice,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getClient().getId(),
                booking.getClient().getName(),
                booking.getRoom().getId(),
                booking.getRoom().getNumber(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getTotalPrice(),
                booking.getCreatedAt()
        );
    }
}
