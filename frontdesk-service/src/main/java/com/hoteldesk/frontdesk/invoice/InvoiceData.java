package com.hoteldesk.frontdesk.invoice;

import com.hoteldesk.frontdesk.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Everything printed on an invoice, detached from the persistence context.
 */
public record InvoiceData(
        Long bookingId,
        String clientName,
        String clientPhone,
        String roomNumber,
        String roomType,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        BigDecimal totalPrice
) {
    public static InvoiceData from(Booking booking) {
        return new InvoiceData(
                booking.getId(),
                booking.getClient().getName(),
                booking.getClient().getPhone(),
                booking.getRoom().getNumber(),
                booking.getRoom().getType(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getTotalPrice()
        );
    }

    public long nights() {
        return ChronoUnit.DAYS.between(checkInDate, checkOutDate);
    }
}
