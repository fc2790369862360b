package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ResourceNotFoundException;

public class BookingNotFoundException extends ResourceNotFoundException {

    public BookingNotFoundException(Long bookingId) {
        super(String.format("Booking with identifier %s not found", bookingId), "BOOKING_NOT_FOUND");
    }
}
