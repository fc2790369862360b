package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.frontdesk.exception.InvalidDateRangeException;
import com.hoteldesk.frontdesk.exception.TotalOutOfRangeException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Stay length and price arithmetic. Totals are rate times whole nights, kept at two decimals.
 */
public final class StayPricing {

    /** Largest total the bookings table stores: 17 integer digits, 2 decimals. */
    public static final BigDecimal MAX_TOTAL = new BigDecimal("99999999999999999.99");

    private StayPricing() {
        // Utility class
    }

    /**
     * Whole nights between check-in and check-out.
     *
     * @throws InvalidDateRangeException if check-out is not strictly after check-in
     */
    public static long nights(LocalDate checkInDate, LocalDate checkOutDate) {
        if (checkInDate == null || checkOutDate == null || !checkOutDate.isAfter(checkInDate)) {
            throw new InvalidDateRangeException(checkInDate, checkOutDate);
        }
        return ChronoUnit.DAYS.between(checkInDate, checkOutDate);
    }

    /**
     * @throws TotalOutOfRangeException if the stay is priced above {@link #MAX_TOTAL}
     */
    public static BigDecimal totalPrice(BigDecimal nightlyRate, LocalDate checkInDate, LocalDate checkOutDate) {
        BigDecimal total = nightlyRate.multiply(BigDecimal.valueOf(nights(checkInDate, checkOutDate)))
                .setScale(2, RoundingMode.HALF_UP);
        if (total.compareTo(MAX_TOTAL) > 0) {
            throw new TotalOutOfRangeException(total, MAX_TOTAL);
        }
        return total;
    }
}
