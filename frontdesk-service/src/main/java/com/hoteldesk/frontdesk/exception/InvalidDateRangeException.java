package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ValidationException;

import java.time.LocalDate;

public class InvalidDateRangeException extends ValidationException {

    public InvalidDateRangeException(LocalDate checkInDate, LocalDate checkOutDate) {
        super(String.format("Check-out date %s must be after check-in date %s", checkOutDate, checkInDate),
                "INVALID_DATE_RANGE");
    }
}
